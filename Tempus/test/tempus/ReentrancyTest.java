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
import static tempus.Fixtures.*;

class ReentrancyTest {

    // A native currency whose payment step calls back into the ledger once.
    static class CallbackCurrency extends NativeCurrency {
        private static final long serialVersionUID = 1L;

        transient DataModel target;
        transient boolean viaYield;

        @Override
        public long capture(AssetBook book, long payer, long amount, long attachedValue) throws LedgerException {
            DataModel dm = target;
            target = null;
            if (dm != null) {
                if (viaYield)
                    dm.yieldRewards(payer, amount, attachedValue, T0);
                else
                    dm.purchase(payer, payer, 0, amount, attachedValue, 0, 0, T0);
            }
            return super.capture(book, payer, amount, attachedValue);
        }
    }

    @Test
    void purchaseCannotBeReenteredFromThePayment() throws Exception {
        CallbackCurrency currency = new CallbackCurrency();
        InitParams p = params();
        p.currency = currency;
        DataModel dm = ledger(p);
        fund(dm, ALICE, 2 * PRICE);
        currency.target = dm;

        assertThatThrownBy(() -> buy(dm, ALICE, PRICE, T0))
                .hasFieldOrPropertyWithValue("code", Error.REENTRANT_CALL);

        assertThat(dm.getSubscription(ALICE)).isNull();
        assertThat(dm.balanceOf(ALICE)).isEqualTo(2 * PRICE);

        // the guard was released
        buy(dm, ALICE, PRICE, T0);
        assertThat(dm.remainingSeconds(ALICE, T0)).isEqualTo(MONTH);
    }

    @Test
    void yieldCannotBeReenteredFromAPurchasePayment() throws Exception {
        CallbackCurrency currency = new CallbackCurrency();
        InitParams p = params();
        p.currency = currency;
        DataModel dm = ledger(p);
        fund(dm, ALICE, 3 * PRICE);
        buy(dm, ALICE, PRICE, T0);
        currency.target = dm;
        currency.viaYield = true;

        assertThatThrownBy(() -> buy(dm, ALICE, PRICE, T0))
                .hasFieldOrPropertyWithValue("code", Error.REENTRANT_CALL);

        assertThat(dm.getPoolDetail().poolBalance).isZero();
        assertThat(dm.remainingSeconds(ALICE, T0)).isEqualTo(MONTH);
        assertThat(dm.busy).isFalse();
    }
}
