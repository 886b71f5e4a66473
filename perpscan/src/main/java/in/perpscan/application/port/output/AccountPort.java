package in.perpscan.application.port.output;

import in.perpscan.domain.model.AccountSnapshot;

/**
 * Output port: account equity and leverage.
 */
public interface AccountPort {
    AccountSnapshot currentAccount();
}
