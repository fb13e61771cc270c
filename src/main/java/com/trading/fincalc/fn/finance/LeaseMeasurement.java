package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.math.Decimals;

/**
 * Lessee lease classification and initial measurement under ASC 842 or IFRS 16.
 * <p>
 * The liability is the present value of the monthly payments at the implicit
 * rate, or the incremental borrowing rate when the implicit rate is unknown,
 * converted to a monthly rate by {@code (1 + annual)^(1/12) - 1}. Payments
 * escalate once a year. A purchase option reasonably certain of exercise is
 * discounted one month past the last payment; a guaranteed residual at the end
 * of the term.
 * <p>
 * Under ASC 842 the lease is a finance lease when any of the five criteria
 * holds. IFRS 16 has a single lessee model and always books a finance lease.
 * Operating leases under ASC 842 expense a straight-line cost, so the
 * right-of-use asset is reduced by that cost less interest.
 */
public final class LeaseMeasurement extends AbstractCalculator<LeaseMeasurement.Input, LeaseMeasurement.Output> {
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal TERM_THRESHOLD = new BigDecimal("0.75");
    private static final BigDecimal PV_THRESHOLD = new BigDecimal("0.90");
    private static final BigDecimal LIABILITY_SNAP = new BigDecimal("-0.01");

    public enum Standard {
        ASC_842("ASC 842"),
        IFRS_16("IFRS 16");

        private final String label;

        Standard(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public enum Classification {
        FINANCE,
        OPERATING
    }

    /**
     * Optional amounts may be null and count as zero; a null implicit rate
     * falls back to the incremental borrowing rate.
     *
     * @param annualEscalation Yearly payment step-up, e.g. 0.03.
     */
    public record Input(String description, Standard standard, int leaseTermMonths, BigDecimal monthlyPayment,
            BigDecimal annualEscalation, BigDecimal incrementalBorrowingRate, BigDecimal implicitRate,
            BigDecimal fairValueOfAsset, int usefulLifeMonths, BigDecimal residualValueGuaranteed,
            BigDecimal purchaseOptionPrice, boolean purchaseOptionReasonablyCertain,
            BigDecimal initialDirectCosts, BigDecimal leaseIncentivesReceived, BigDecimal prepaidLeasePayments,
            boolean transferOfOwnership, boolean specializedAsset) {
    }

    public record Criterion(String testName, boolean passed, String detail) {
    }

    public record Row(int month, BigDecimal beginningLiability, BigDecimal payment, BigDecimal interestExpense,
            BigDecimal principalReduction, BigDecimal endingLiability, BigDecimal rouAsset,
            BigDecimal depreciation) {
    }

    /**
     * @param weightedAverageLeaseTerm Lease term in years.
     * @param presentValueToFairValue  Initial liability over the asset's fair
     *                                 value.
     */
    public record Output(String standard, Classification classification, List<Criterion> criteria,
            BigDecimal initialRouAsset, BigDecimal initialLeaseLiability, BigDecimal totalLeasePayments,
            BigDecimal totalInterestExpense, BigDecimal totalDepreciation, List<Row> schedule,
            BigDecimal weightedAverageLeaseTerm, BigDecimal presentValueToFairValue) {
    }

    private final DecimalMath math;

    public LeaseMeasurement(DecimalKernel kernel) {
        super(kernel);
        this.math = kernel.math();
    }

    @Override
    protected String methodology() {
        return "Lease classification and measurement (ASC 842 / IFRS 16)";
    }

    @Override
    protected void validate(Input in) {
        require(in.standard() != null, "standard is required");
        require(in.leaseTermMonths() > 0, "leaseTermMonths must be > 0");
        require(in.monthlyPayment() != null && in.monthlyPayment().signum() > 0, "monthlyPayment must be positive");
        require(in.incrementalBorrowingRate() != null && in.incrementalBorrowingRate().signum() > 0,
                "incrementalBorrowingRate must be positive");
        require(in.implicitRate() == null || in.implicitRate().compareTo(BigDecimal.ONE.negate()) > 0,
                "implicitRate must be > -1");
        require(in.fairValueOfAsset() != null && in.fairValueOfAsset().signum() > 0,
                "fairValueOfAsset must be positive");
        require(in.usefulLifeMonths() > 0, "usefulLifeMonths must be > 0");
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        BigDecimal annualRate = in.implicitRate() != null ? in.implicitRate() : in.incrementalBorrowingRate();
        BigDecimal monthlyRate = math.nthRoot(BigDecimal.ONE.add(annualRate, mc), 12).subtract(BigDecimal.ONE, mc);
        BigDecimal onePlusR = BigDecimal.ONE.add(monthlyRate, mc);

        // 1. Payments and their present value
        BigDecimal[] payments = payments(in);
        BigDecimal totalPayments = Decimals.sum(payments, mc);
        BigDecimal liability = BigDecimal.ZERO;
        BigDecimal discount = BigDecimal.ONE;
        for (BigDecimal payment : payments) {
            discount = discount.multiply(onePlusR, mc);
            liability = liability.add(payment.divide(discount, mc), mc);
        }
        BigDecimal termDiscount = discount;

        boolean optionCertain = in.purchaseOptionReasonablyCertain() && in.purchaseOptionPrice() != null;
        if (optionCertain)
            liability = liability.add(in.purchaseOptionPrice().divide(termDiscount.multiply(onePlusR, mc), mc), mc);
        if (in.residualValueGuaranteed() != null)
            liability = liability.add(in.residualValueGuaranteed().divide(termDiscount, mc), mc);

        BigDecimal rou = liability.add(orZero(in.initialDirectCosts()), mc)
                .add(orZero(in.prepaidLeasePayments()), mc)
                .subtract(orZero(in.leaseIncentivesReceived()), mc);

        // 2. Classification
        BigDecimal pvRatio = liability.divide(in.fairValueOfAsset(), mc);
        List<Criterion> criteria = criteria(in, optionCertain, pvRatio);
        boolean anyMet = criteria.stream().anyMatch(Criterion::passed);
        Classification classification = in.standard() == Standard.IFRS_16 || anyMet
                ? Classification.FINANCE
                : Classification.OPERATING;
        if (rou.signum() < 0)
            warnings.add("Lease incentives exceed the lease liability, right-of-use asset is negative");

        // 3. Amortization
        int depreciationMonths = in.transferOfOwnership() || optionCertain
                ? in.usefulLifeMonths()
                : Math.min(in.leaseTermMonths(), in.usefulLifeMonths());
        boolean straightLine = in.standard() == Standard.ASC_842 && classification == Classification.OPERATING;
        List<Row> schedule = schedule(payments, liability, rou, monthlyRate, depreciationMonths, straightLine,
                totalPayments);

        BigDecimal totalInterest = BigDecimal.ZERO;
        BigDecimal totalDepreciation = BigDecimal.ZERO;
        for (Row row : schedule) {
            totalInterest = totalInterest.add(row.interestExpense(), mc);
            totalDepreciation = totalDepreciation.add(row.depreciation(), mc);
        }

        return new Output(in.standard().label(), classification, criteria, rou, liability, totalPayments,
                totalInterest, totalDepreciation, schedule,
                BigDecimal.valueOf(in.leaseTermMonths()).divide(TWELVE, mc), pvRatio);
    }

    private BigDecimal[] payments(Input in) {
        BigDecimal step = BigDecimal.ONE.add(orZero(in.annualEscalation()), mc);
        BigDecimal[] payments = new BigDecimal[in.leaseTermMonths()];
        BigDecimal payment = in.monthlyPayment();
        for (int m = 0; m < payments.length; m++) {
            if (m > 0 && m % 12 == 0)
                payment = payment.multiply(step, mc);
            payments[m] = payment;
        }
        return payments;
    }

    private List<Criterion> criteria(Input in, boolean optionCertain, BigDecimal pvRatio) {
        List<Criterion> criteria = new ArrayList<>(5);
        criteria.add(new Criterion("Transfer of Ownership", in.transferOfOwnership(),
                in.transferOfOwnership()
                        ? "Ownership transfers to lessee at end of lease term"
                        : "No transfer of ownership at lease end"));
        criteria.add(new Criterion("Purchase Option Reasonably Certain", optionCertain,
                optionCertain
                        ? "Purchase option of " + in.purchaseOptionPrice().toPlainString()
                                + " is reasonably certain to be exercised"
                        : "No purchase option reasonably certain to be exercised"));

        BigDecimal termRatio = BigDecimal.valueOf(in.leaseTermMonths())
                .divide(BigDecimal.valueOf(in.usefulLifeMonths()), mc);
        criteria.add(new Criterion("Lease Term >= 75% of Useful Life", termRatio.compareTo(TERM_THRESHOLD) >= 0,
                "Lease term " + in.leaseTermMonths() + "/" + in.usefulLifeMonths() + " months = "
                        + percent(termRatio) + "% of useful life (threshold: 75%)"));
        criteria.add(new Criterion("PV of Payments >= 90% of Fair Value", pvRatio.compareTo(PV_THRESHOLD) >= 0,
                "PV of payments / FMV = " + percent(pvRatio) + "% (threshold: 90%)"));
        criteria.add(new Criterion("Specialized Asset with No Alternative Use", in.specializedAsset(),
                in.specializedAsset()
                        ? "Asset is specialized with no alternative use to the lessor"
                        : "Asset is not specialized; has alternative uses"));
        return criteria;
    }

    private List<Row> schedule(BigDecimal[] payments, BigDecimal liability, BigDecimal rou, BigDecimal monthlyRate,
            int depreciationMonths, boolean straightLine, BigDecimal totalPayments) {
        BigDecimal monthlyDepreciation = rou.divide(BigDecimal.valueOf(depreciationMonths), mc);
        BigDecimal straightLineCost = totalPayments.divide(BigDecimal.valueOf(payments.length), mc);

        List<Row> rows = new ArrayList<>(payments.length);
        for (int i = 0; i < payments.length; i++) {
            int month = i + 1;
            BigDecimal payment = payments[i];
            BigDecimal beginning = liability;
            BigDecimal interest = beginning.multiply(monthlyRate, mc);
            liability = beginning.add(interest, mc).subtract(payment, mc);

            BigDecimal depreciation = BigDecimal.ZERO;
            if (month <= depreciationMonths)
                depreciation = straightLine ? straightLineCost.subtract(interest, mc) : monthlyDepreciation;
            rou = rou.subtract(depreciation, mc);
            if (rou.signum() < 0)
                rou = BigDecimal.ZERO;
            // Rounding dust on the final payment
            if (liability.signum() < 0 && liability.compareTo(LIABILITY_SNAP) > 0)
                liability = BigDecimal.ZERO;

            rows.add(new Row(month, beginning, payment, interest, payment.subtract(interest, mc), liability, rou,
                    depreciation));
        }
        return List.copyOf(rows);
    }

    private static String percent(BigDecimal ratio) {
        return ratio.multiply(Decimals.HUNDRED).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
