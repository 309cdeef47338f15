package com.paperharvest.backend.scraping;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PageResponse {
    private int status;
    private String body;

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
