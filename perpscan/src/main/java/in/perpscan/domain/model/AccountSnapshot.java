package in.perpscan.domain.model;

import java.math.BigDecimal;

/**
 * Account equity and leverage as supplied by the account collaborator.
 * Not validated on construction: the structurer decides what is tradeable.
 */
public record AccountSnapshot(BigDecimal equity, BigDecimal leverage) {

    public boolean isTradeable() {
        return equity != null && leverage != null
                && equity.signum() > 0 && leverage.signum() > 0;
    }
}
