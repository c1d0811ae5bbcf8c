package org.javai.experiment.analysis;

import org.apache.commons.math3.random.Well19937c;
import org.javai.experiment.model.Goal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BootstrapComparisonTest {

    private static final Goal SIGNUP = Goal.conversion("signup", 0.01);

    private BootstrapComparison bootstrap;
    private ComparisonContext context;

    @BeforeEach
    void setUp() {
        bootstrap = new BootstrapComparison(500);
        context = new ComparisonContext("huge", 0.95, new Well19937c(42));
    }

    @Test
    void binaryArmsBeyondIntRange_useNormalApproximation() throws AnalysisCancelledException {
        long n = 3_000_000_000L;
        ArmData control = ArmData.binary("A", n, 300_000_000L);
        ArmData treatment = ArmData.binary("B", n, 360_000_000L);

        VariantComparison b = bootstrap.compare(SIGNUP, control, treatment, context);

        assertThat(b.difference()).isCloseTo(0.02, within(1e-12));
        assertThat(b.interval().lower()).isCloseTo(0.02, within(1e-4));
        assertThat(b.interval().upper()).isCloseTo(0.02, within(1e-4));
        assertThat(b.pValue()).isZero();
        assertThat(b.variantSample()).isEqualTo(n);
    }

    @Test
    void armsWithoutConversions_resampleToZero() throws AnalysisCancelledException {
        VariantComparison b = bootstrap.compare(SIGNUP, ArmData.binary("A", 400, 0), ArmData.binary("B", 400, 0),
                context);

        assertThat(b.difference()).isZero();
        assertThat(b.interval().lower()).isZero();
        assertThat(b.interval().upper()).isZero();
        assertThat(b.pValue()).isEqualTo(1.0);
    }
}
