package com.rentdesk.backend.dto.tenant;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PropertyRequestDTO {

    @NotBlank(message = "name is required")
    private String name;

    @NotBlank(message = "address is required")
    private String address;

    @NotBlank(message = "city is required")
    private String city;

    @NotBlank(message = "province is required")
    private String province;

    @NotBlank(message = "postalCode is required")
    private String postalCode;
}
