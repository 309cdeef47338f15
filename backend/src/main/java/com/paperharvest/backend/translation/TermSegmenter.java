package com.paperharvest.backend.translation;

import java.util.List;

/**
 * Finds candidate technical terms in an English text
 */
public interface TermSegmenter {

    /**
     * Distinct terms in order of first appearance, in the casing they first appear with
     */
    List<String> segment(String text);
}
