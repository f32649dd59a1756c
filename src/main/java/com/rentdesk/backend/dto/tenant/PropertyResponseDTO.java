package com.rentdesk.backend.dto.tenant;

import lombok.Data;

@Data
public class PropertyResponseDTO {

    private String id;
    private String name;
    private String address;
    private String city;
    private String province;
    private String postalCode;
}
