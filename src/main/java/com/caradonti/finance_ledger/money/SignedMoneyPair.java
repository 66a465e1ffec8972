package com.caradonti.finance_ledger.money;

import com.caradonti.finance_ledger.exception.InvalidAmountException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A signed ARS/USD pair: a net balance or a reconciliation difference.
 * Unlike {@link MoneyPair}, either field may be negative.
 */
@Value
public class SignedMoneyPair {

    public static final SignedMoneyPair ZERO = new SignedMoneyPair(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal ars;
    BigDecimal usd;

    public SignedMoneyPair(BigDecimal ars, BigDecimal usd) {
        this.ars = (ars == null ? BigDecimal.ZERO : ars).setScale(MoneyPair.SCALE, RoundingMode.HALF_UP);
        this.usd = (usd == null ? BigDecimal.ZERO : usd).setScale(MoneyPair.SCALE, RoundingMode.HALF_UP);
    }

    public SignedMoneyPair add(SignedMoneyPair other) {
        return new SignedMoneyPair(ars.add(other.ars), usd.add(other.usd));
    }

    public SignedMoneyPair subtract(SignedMoneyPair other) {
        return new SignedMoneyPair(ars.subtract(other.ars), usd.subtract(other.usd));
    }

    public SignedMoneyPair negate() {
        return new SignedMoneyPair(ars.negate(), usd.negate());
    }

    public BigDecimal get(Currency currency) {
        return currency == Currency.ARS ? ars : usd;
    }

    public boolean isNonNegative() {
        return ars.signum() >= 0 && usd.signum() >= 0;
    }

    /**
     * Converts to a {@link MoneyPair}.
     *
     * @throws InvalidAmountException if either field is negative
     */
    public MoneyPair toMoneyPair() {
        return MoneyPair.of(ars, usd);
    }

    @Override
    public String toString() {
        return "ARS " + ars.toPlainString() + " / USD " + usd.toPlainString();
    }
}
