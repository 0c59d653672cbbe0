package com.example.bulk_campaign.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class BulkSheetRequest {

    private List<String> keywords;

    private List<String> skus;

    @Valid
    @NotNull
    private CampaignSettingsRequest settings;
}
