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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionLedgerTest {

    static final long NOW = 1000;

    static Tier tier(int id, long period, long price) {
        return new Tier(id, new TierParams(period, price));
    }

    // 600s left, of which 400s paid and 200s granted
    static Subscription mixed() {
        Subscription sub = new Subscription();
        sub.tierId = 1;
        sub.expiresAt = NOW + 600;
        sub.purchaseExpires = NOW + 400;
        sub.grantedSeconds = 200;
        sub.purchasedSeconds = 400;
        return sub;
    }

    @Test
    void initialMintPriceIsChargedOnce() throws Exception {
        Tier t = tier(1, 1000, 100);
        t.params.initialMintPrice = 50;
        Subscription fresh = new Subscription();

        assertThat(SubscriptionLedger.tokensToSeconds(t, fresh, 250)).isEqualTo(2000);
        assertThatThrownBy(() -> SubscriptionLedger.tokensToSeconds(t, fresh, 120))
                .hasFieldOrPropertyWithValue("code", Error.PURCHASE_TOO_SMALL);
        assertThat(SubscriptionLedger.tokensToSeconds(t, mixed(), 250)).isEqualTo(2500);
    }

    @Test
    void switchingToDearerTierShrinksRemainingTime() throws Exception {
        Subscription sub = mixed();

        SubscriptionLedger.convertTier(sub, tier(1, 1000, 100), tier(2, 1000, 200), NOW);

        assertThat(sub.tierId).isEqualTo(2);
        assertThat(sub.expiresAt).isEqualTo(NOW + 300);
        assertThat(sub.purchaseExpires).isEqualTo(NOW + 200);
        assertThat(sub.grantedSeconds).isEqualTo(100);
    }

    @Test
    void conversionThatWouldPassTheEndOfTimeFails() {
        Subscription sub = mixed();
        Tier endless = tier(2, Long.MAX_VALUE - 10, 1);

        // 600s left are worth one token, which buys almost Long.MAX_VALUE seconds
        assertThatThrownBy(() -> SubscriptionLedger.convertTier(sub, tier(1, 600, 1), endless, NOW))
                .hasFieldOrPropertyWithValue("code", Error.OVERFLOW);
        assertThat(sub.expiresAt).isEqualTo(NOW + 600);
        assertThat(sub.tierId).isEqualTo(1);
    }

    @Test
    void revokeRemovesOnlyGrantedTime() {
        Subscription sub = mixed();

        assertThat(SubscriptionLedger.revokeGranted(sub, NOW)).isEqualTo(200);
        assertThat(sub.expiresAt).isEqualTo(NOW + 400);
        assertThat(sub.grantedSeconds).isZero();
        assertThat(SubscriptionLedger.revokeGranted(sub, NOW)).isZero();
    }

    @Test
    void refundRemovesPaidTimeWorthTheTokens() throws Exception {
        Subscription sub = mixed();

        assertThat(SubscriptionLedger.refundPaid(sub, tier(1, 1000, 100), 10, NOW)).isEqualTo(100);
        assertThat(sub.purchaseExpires).isEqualTo(NOW + 300);
        assertThat(sub.expiresAt).isEqualTo(NOW + 500);
    }

    @Test
    void supplyCapCannotDropBelowMinted() throws Exception {
        SubscriptionLedger ledger = new SubscriptionLedger();
        ledger.mint();
        ledger.mint();

        assertThatThrownBy(() -> ledger.setSupplyCap(1))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_SUPPLY_CAP);
        ledger.setSupplyCap(2);
        assertThatThrownBy(ledger::checkMint)
                .hasFieldOrPropertyWithValue("code", Error.GLOBAL_SUPPLY_EXCEEDED);
        assertThat(ledger.mint()).isEqualTo(3);
    }
}
