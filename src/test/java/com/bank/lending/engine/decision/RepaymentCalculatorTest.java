package com.bank.lending.engine.decision;

import com.bank.lending.config.ProductConfig;
import com.bank.lending.model.LoanOffer;
import com.bank.lending.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RepaymentCalculatorTest {

    private ProductConfig product;
    private RepaymentCalculator calculator;

    @BeforeEach
    void setUp() {
        product = TestDataFactory.createProductConfig();
        calculator = new RepaymentCalculator(product);
    }

    @Test
    void totalInterest_belowCap_isSimpleInterest() {
        // 0.8% per day * 30.4 days * 4 months
        assertThat(calculator.totalInterest(500.0, 4)).isCloseTo(486.4, within(1e-6));
    }

    @Test
    void totalInterest_neverExceedsCostCap() {
        // Uncapped would be 0.2432 * 6 = 145.9% of principal
        assertThat(calculator.totalInterest(500.0, 6)).isCloseTo(500.0, within(1e-6));
    }

    @Test
    void monthlyRepayment_spreadsPrincipalAndInterest() {
        assertThat(calculator.monthlyRepayment(500.0, 4)).isCloseTo(246.6, within(1e-6));
        assertThat(calculator.monthlyRepayment(600.0, 6)).isCloseTo(200.0, within(1e-6));
    }

    @Test
    void monthlyRepayment_nonPositiveInputs_isZero() {
        assertThat(calculator.monthlyRepayment(0.0, 4)).isEqualTo(0.0);
        assertThat(calculator.monthlyRepayment(500.0, 0)).isEqualTo(0.0);
    }

    @Test
    void maxAffordablePrincipal_keepsBufferAndCapsAtProductMaximum() {
        // (300 - 50) * 3 / (1 + 0.2432 * 3)
        assertThat(calculator.maxAffordablePrincipal(300.0, 3)).isCloseTo(433.63, within(0.01));
        assertThat(calculator.maxAffordablePrincipal(5000.0, 6)).isEqualTo(1500.0);
    }

    @Test
    void maxAffordablePrincipal_disposableWithinBuffer_isZero() {
        assertThat(calculator.maxAffordablePrincipal(50.0, 4)).isEqualTo(0.0);
        assertThat(calculator.maxAffordablePrincipal(-200.0, 4)).isEqualTo(0.0);
    }

    @Test
    void offer_roundsFigures() {
        LoanOffer offer = calculator.offer(500.0, 4);

        assertThat(offer.getPrincipal()).isEqualTo(500.0);
        assertThat(offer.getTermMonths()).isEqualTo(4);
        assertThat(offer.getMonthlyRepayment()).isEqualTo(246.6);
        assertThat(offer.getTotalRepayable()).isEqualTo(986.4);
        assertThat(offer.getIndicativeApr()).isEqualTo(291.8);
        assertThat(offer.getDailyInterestRate()).isEqualTo(0.008);
    }

    @Test
    void offer_zeroPrincipal_isEmptyOffer() {
        LoanOffer offer = calculator.offer(0.0, 3);

        assertThat(offer.getPrincipal()).isEqualTo(0.0);
        assertThat(offer.getMonthlyRepayment()).isEqualTo(0.0);
        assertThat(offer.getTermMonths()).isEqualTo(3);
    }
}
