package com.caradonti.finance_ledger.money;

import com.caradonti.finance_ledger.exception.InvalidAmountException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A non-negative amount held in both ARS and USD.
 *
 * Both fields are stored with a scale of 2 so that sums over thousands of
 * entries never drift at the cent level.
 *
 * Invariant: neither field is ever negative. Operations that would produce a
 * negative field fail with {@link InvalidAmountException}.
 */
@Value
public class MoneyPair {

    public static final int SCALE = 2;
    public static final MoneyPair ZERO = new MoneyPair(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal ars;
    BigDecimal usd;

    private MoneyPair(BigDecimal ars, BigDecimal usd) {
        this.ars = normalize(ars, Currency.ARS);
        this.usd = normalize(usd, Currency.USD);
    }

    /**
     * Creates a pair, treating a missing amount as zero.
     *
     * @throws InvalidAmountException if either amount is negative
     */
    public static MoneyPair of(BigDecimal ars, BigDecimal usd) {
        return new MoneyPair(ars, usd);
    }

    public static MoneyPair of(String ars, String usd) {
        return new MoneyPair(new BigDecimal(ars), new BigDecimal(usd));
    }

    public static MoneyPair ars(BigDecimal ars) {
        return new MoneyPair(ars, BigDecimal.ZERO);
    }

    public static MoneyPair usd(BigDecimal usd) {
        return new MoneyPair(BigDecimal.ZERO, usd);
    }

    public MoneyPair add(MoneyPair other) {
        return new MoneyPair(ars.add(other.ars), usd.add(other.usd));
    }

    /**
     * Subtracts another pair field by field.
     *
     * @throws InvalidAmountException if the result would be negative in any currency
     */
    public MoneyPair subtract(MoneyPair other) {
        BigDecimal newArs = ars.subtract(other.ars);
        BigDecimal newUsd = usd.subtract(other.usd);
        if (newArs.signum() < 0 || newUsd.signum() < 0) {
            throw new InvalidAmountException(String.format(
                "Cannot subtract %s from %s: result would be negative", other, this));
        }
        return new MoneyPair(newArs, newUsd);
    }

    /**
     * Signed balance of income minus expense. The result may be negative.
     */
    public static SignedMoneyPair net(MoneyPair income, MoneyPair expense) {
        return new SignedMoneyPair(
            income.ars.subtract(expense.ars),
            income.usd.subtract(expense.usd)
        );
    }

    public BigDecimal get(Currency currency) {
        return currency == Currency.ARS ? ars : usd;
    }

    public boolean isZero() {
        return ars.signum() == 0 && usd.signum() == 0;
    }

    public boolean hasAmountIn(Currency currency) {
        return get(currency).signum() > 0;
    }

    public SignedMoneyPair toSigned() {
        return new SignedMoneyPair(ars, usd);
    }

    @Override
    public String toString() {
        return "ARS " + ars.toPlainString() + " / USD " + usd.toPlainString();
    }

    private static BigDecimal normalize(BigDecimal amount, Currency currency) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        if (amount.signum() < 0) {
            throw new InvalidAmountException(
                String.format("%s amount must not be negative: %s", currency, amount.toPlainString()));
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
