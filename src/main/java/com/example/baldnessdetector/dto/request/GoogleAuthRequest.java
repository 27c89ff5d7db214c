package com.example.baldnessdetector.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class GoogleAuthRequest {
    @NotBlank(message = "access_token must not be blank")
    @JsonProperty("access_token")
    String accessToken;

    @JsonProperty("id_token")
    String idToken;
}
