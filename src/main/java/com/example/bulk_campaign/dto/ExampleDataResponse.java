package com.example.bulk_campaign.dto;

import java.util.List;

public record ExampleDataResponse(
        List<String> keywords,
        List<String> skus) {
}
