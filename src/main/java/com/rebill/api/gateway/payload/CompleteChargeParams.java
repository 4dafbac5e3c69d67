package com.rebill.api.gateway.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "CompleteChargeParams")
public class CompleteChargeParams {

    @Schema(required = true, description = "completion token that the hosted form appended to the redirect url")
    @NotBlank
    private String tokenId;
}
