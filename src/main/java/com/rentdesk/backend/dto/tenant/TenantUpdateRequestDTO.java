package com.rentdesk.backend.dto.tenant;

import jakarta.validation.constraints.Email;
import lombok.Data;

/**
 * Partial tenant update: a {@code null} field keeps the stored value. A blank email clears it.
 */
@Data
public class TenantUpdateRequestDTO {

    private String firstName;

    private String lastName;

    @Email(message = "email is invalid")
    private String email;

    private String phone;
}
