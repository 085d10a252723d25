/*
 * Copyright (C) 2024 The Tempus Project
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package tempus;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shared setup for the ledger tests: a few well-known accounts and a 
 *   ledger with one monthly tier.
 */
final class Fixtures {

    static final long T0 = 1_700_000_000L;
    static final long MONTH = 30 * Timestamp.DAY;

    // 0.001 unit
    static final long PRICE = Main.COIN / 1000;

    static final long OWNER = 1;
    static final long AGENT = 2;
    static final long ISSUER = 3;
    static final long PROTOCOL = 10;
    static final long CLIENT = 11;
    static final long ALICE = 100;
    static final long BOB = 101;
    static final long CAROL = 102;
    static final long DAVE = 103;
    static final long REFERRER = 200;

    static final long[] OUTSIDE_ACCOUNTS = { OWNER, AGENT, ISSUER, PROTOCOL, CLIENT, ALICE, BOB, CAROL, DAVE, REFERRER };

    private Fixtures() {
    }

    static InitParams params(long periodSeconds, long price) {
        InitParams p = new InitParams(OWNER);
        p.tier = new TierParams(periodSeconds, price);
        return p;
    }

    static InitParams params() {
        return params(MONTH, PRICE);
    }

    static DataModel ledger(InitParams params) throws LedgerException {
        DataModel dm = new DataModel();
        dm.initialize(params, T0);
        dm.grantRoles(OWNER, AGENT, AccessControl.ROLE_AGENT, T0);
        dm.grantRoles(OWNER, ISSUER, AccessControl.ROLE_ISSUER, T0);
        return dm;
    }

    static DataModel ledger() throws LedgerException {
        return ledger(params());
    }

    static void fund(DataModel dm, long account, long amount) throws LedgerException {
        dm.deposit(OWNER, account, amount, T0);
    }

    // Self-purchase on the current tier (or tier 1), native currency.
    static PurchaseResult buy(DataModel dm, long account, long amount, long now) throws LedgerException {
        return dm.purchase(account, account, 0, amount, amount, 0, 0, now);
    }

    static PurchaseResult buy(DataModel dm, long account, int tierId, long amount, long now) throws LedgerException {
        return dm.purchase(account, account, tierId, amount, amount, 0, 0, now);
    }

    static long sumOfShares(DataModel dm) {
        long sum = 0;
        for (Map.Entry<Long, Holder> e : dm.pool.holders.entrySet())
            sum += e.getValue().numShares;
        return sum;
    }

    // Everything ever deposited is somewhere: outside, in the ledger, or burnt.
    static void assertConserved(DataModel dm, long totalDeposited) {
        String asset = dm.getCurrency().getAssetKey();
        long outside = 0;
        for (long account : OUTSIDE_ACCOUNTS)
            outside += dm.getAssetBook().balanceOf(asset, account);
        AssetBook book = dm.getAssetBook();
        assertThat(outside + book.heldByLedger(asset) + book.burntBy(asset)).isEqualTo(totalDeposited);
        assertThat(dm.contractBalance()).isEqualTo(dm.creatorBalance() + dm.getPoolDetail().poolBalance);
        assertThat(dm.creatorBalance()).isGreaterThanOrEqualTo(0);
        assertThat(sumOfShares(dm)).isEqualTo(dm.getPoolDetail().totalShares);
        long owed = 0;
        for (long account : dm.pool.holders.keySet())
            owed += dm.rewardBalanceOf(account);
        assertThat(owed).isLessThanOrEqualTo(dm.getPoolDetail().poolBalance);
    }
}
