package com.tony.franchiseSimulator.model.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class DraftOrderRequest {
    private String teamName;

    @Min(0)
    private int wins;

    @Min(0)
    private int losses;

    private int year;
}
