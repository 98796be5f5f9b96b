package com.deliveryroute.tracking.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TrackingHoursRequest {

    @NotNull
    @Min(value = 0, message = "Start hour must be between 0 and 23")
    @Max(value = 23, message = "Start hour must be between 0 and 23")
    private Integer startHour;

    @NotNull
    @Min(value = 0, message = "End hour must be between 0 and 23")
    @Max(value = 23, message = "End hour must be between 0 and 23")
    private Integer endHour;
}
