package com.tradezzz.api.dto.request;

import com.tradezzz.domain.enums.TradingMode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mode change for the caller's session. Switching to LIVE requires {@code acknowledged=true}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwitchModeRequest {

    @NotNull
    private TradingMode mode;

    private boolean acknowledged;
}
