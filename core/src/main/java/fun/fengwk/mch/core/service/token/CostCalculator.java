package fun.fengwk.mch.core.service.token;

import fun.fengwk.mch.core.facade.provider.ProviderSettings;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices token usage with the per 1k token rates of a provider.
 *
 * @author fengwk
 */
@Component
public class CostCalculator {

    static final int SCALE = 6;

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    public BigDecimal cost(TokenUsage usage, ProviderSettings settings) {
        if (usage == null || settings == null) {
            return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        }
        BigDecimal input = price(usage.getInputTokens(), settings.getInputCostPer1k());
        BigDecimal output = price(usage.getOutputTokens(), settings.getOutputCostPer1k());
        return input.add(output).setScale(SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal price(long tokens, BigDecimal costPer1k) {
        if (costPer1k == null || tokens <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(tokens).multiply(costPer1k).divide(THOUSAND, SCALE + 4, RoundingMode.HALF_UP);
    }

}
