package com.tradezzz.risk.sizing;

import com.tradezzz.domain.enums.PositionSizingMethod;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@link PositionSizer} for a {@link PositionSizingMethod}.
 */
@Component
public class PositionSizerFactory {

    private final Map<PositionSizingMethod, PositionSizer> sizers = new EnumMap<>(PositionSizingMethod.class);

    public PositionSizerFactory() {
        this(List.of(
                new FixedPercentageSizer(),
                new KellyCriterionSizer(),
                new FixedAmountSizer(),
                new VolatilityAdjustedSizer()));
    }

    PositionSizerFactory(List<PositionSizer> sizers) {
        for (PositionSizer sizer : sizers) {
            this.sizers.put(sizer.getMethod(), sizer);
        }
    }

    public PositionSizer getSizer(PositionSizingMethod method) {
        PositionSizer sizer = sizers.get(method);
        if (sizer == null) {
            throw new IllegalArgumentException("Unsupported position sizing method: " + method);
        }
        return sizer;
    }
}
