package in.perpscan.infrastructure.marketdata;

import in.perpscan.application.port.output.AccountPort;
import in.perpscan.domain.model.AccountSnapshot;
import in.perpscan.util.Env;

import java.math.BigDecimal;

/**
 * Fixed account snapshot, from ACCOUNT_EQUITY / ACCOUNT_LEVERAGE when not given explicitly.
 */
public final class StaticAccountSource implements AccountPort {

    private final AccountSnapshot snapshot;

    public StaticAccountSource(AccountSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public static StaticAccountSource fromEnv() {
        return new StaticAccountSource(new AccountSnapshot(
            Env.getDecimal("ACCOUNT_EQUITY", new BigDecimal("1000")),
            Env.getDecimal("ACCOUNT_LEVERAGE", BigDecimal.ONE)
        ));
    }

    @Override
    public AccountSnapshot currentAccount() {
        return snapshot;
    }
}
