package com.example.baldnessdetector.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class EmailAuthRequest {
    @NotBlank(message = "email must not be blank")
    @Email(message = "email must be a valid address")
    @Size(max = 255, message = "email cannot exceed 255 characters")
    String email;

    @NotBlank(message = "name cannot be empty")
    @Size(max = 255, message = "name cannot exceed 255 characters")
    String name;

    @Size(max = 1024, message = "picture cannot exceed 1024 characters")
    String picture;
}
