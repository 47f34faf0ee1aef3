package com.jay.lbomodel.layer1_assumptions;

import com.jay.lbomodel.config.ModelConfig;
import com.jay.lbomodel.exception.InvalidAssumptionException;
import com.jay.lbomodel.model.AssumptionRequest;
import com.jay.lbomodel.model.AssumptionSet;
import com.jay.lbomodel.model.SensitivityRanges;
import com.jay.lbomodel.model.SensitivityRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jay.lbomodel.LboFixtures.acme;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AssumptionFactory")
class AssumptionFactoryTest {

    private ModelConfig config;
    private AssumptionFactory factory;

    @BeforeEach
    void setUp() {
        config = new ModelConfig();
        factory = new AssumptionFactory(config);
    }

    @Test
    @DisplayName("Base case should come straight from the configured deal")
    void baseCaseMatchesConfiguredDeal() {
        assertThat(factory.baseCase()).isEqualTo(acme().taxRate(0.21).build());
    }

    @Test
    @DisplayName("Request fields should override the base case, the rest should fall back")
    void requestOverridesBaseCase() {
        AssumptionRequest request = new AssumptionRequest();
        request.setCompanyName("Globex");
        request.setRevenueGrowthPct(12.0);
        request.setExitYear(2030);
        request.setExitMultiple(9.0);

        AssumptionSet set = factory.fromRequest(request);

        assertThat(set.getCompanyName()).isEqualTo("Globex");
        assertThat(set.getRevenueGrowth()).isEqualTo(0.12);
        assertThat(set.getHoldingPeriod()).isEqualTo(7);
        assertThat(set.getExitMultiple()).isEqualTo(9.0);
        assertThat(set.getPurchasePriceMultiple()).isEqualTo(10.0);
        assertThat(set.getDebtAmount()).isEqualTo(750.0);
    }

    @Test
    @DisplayName("Invalid merged inputs should be rejected")
    void invalidRequestIsRejected() {
        AssumptionRequest request = new AssumptionRequest();
        request.setAmortizationYears(0);

        assertThatThrownBy(() -> factory.fromRequest(request))
            .isInstanceOf(InvalidAssumptionException.class);
    }

    @Test
    @DisplayName("Omitted sweep lists should use the configured ladder")
    void rangesFillMissingLists() {
        config.sensitivity().setStep(0.5);
        config.sensitivity().setPointsEachSide(1);
        AssumptionSet base = factory.baseCase();

        SensitivityRequest request = new SensitivityRequest();
        request.setExitMultiples(List.of(7.0, 13.0));
        request.setExitMarginPcts(List.of());

        SensitivityRanges ranges = factory.rangesFor(base, request);

        assertThat(ranges.exitMultiples()).containsExactly(7.0, 13.0);
        assertThat(ranges.revenueGrowthPcts()).containsExactly(7.5, 8.0, 8.5);
        assertThat(ranges.exitMarginPcts()).containsExactly(29.5, 30.0, 30.5);
        assertThat(factory.rangesFor(base, null).exitMultiples()).containsExactly(9.5, 10.0, 10.5);
    }
}
