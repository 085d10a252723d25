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

class AdministrationTest {

    @Test
    void initializationHappensOnce() throws Exception {
        DataModel dm = ledger();

        assertThatThrownBy(() -> dm.initialize(params(), T0))
                .hasFieldOrPropertyWithValue("code", Error.ALREADY_INITIALIZED);
        assertThatThrownBy(() -> new DataModel().purchase(ALICE, ALICE, 0, PRICE, PRICE, 0, 0, T0))
                .hasFieldOrPropertyWithValue("code", Error.NOT_INITIALIZED);
        assertThat(dm.getTierCount()).isEqualTo(1);
        assertThat(dm.getPoolDetail().numCurves).isEqualTo(1);
    }

    @Test
    void badInitialFeesAreRejected() {
        InitParams p = params();
        p.fees = new FeeParams(PROTOCOL, 1000, CLIENT, 500, 0);

        assertThatThrownBy(() -> new DataModel().initialize(p, T0))
                .isInstanceOfSatisfying(LedgerException.class, 
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.VALIDATION))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_FEE_PARAMS);
    }

    @Test
    void zeroRecipientZeroesItsBps() throws Exception {
        InitParams p = params();
        p.fees = new FeeParams(0, 500, CLIENT, 0, 0);
        DataModel dm = ledger(p);

        FeeParams fees = dm.getFeeParams();
        assertThat(fees.protocolBps).isZero();
        assertThat(fees.clientRecipient).isZero();
    }

    @Test
    void onlyTheCurrentRecipientMovesItsFee() throws Exception {
        InitParams p = params();
        p.fees = new FeeParams(PROTOCOL, 500, CLIENT, 500, 100);
        DataModel dm = ledger(p);

        assertThatThrownBy(() -> dm.updateProtocolFeeRecipient(OWNER, DAVE, T0))
                .isInstanceOfSatisfying(LedgerException.class, 
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_ELIGIBLE))
                .hasFieldOrPropertyWithValue("code", Error.NOT_FEE_RECIPIENT);

        dm.updateProtocolFeeRecipient(PROTOCOL, DAVE, T0);
        dm.updateClientFees(CLIENT, 700, 200, T0);

        FeeParams fees = dm.getFeeParams();
        assertThat(fees.protocolRecipient).isEqualTo(DAVE);
        assertThat(fees.protocolBps).isEqualTo(500);
        assertThat(fees.clientBps).isEqualTo(700);
        assertThat(fees.clientReferralBps).isEqualTo(200);

        assertThatThrownBy(() -> dm.updateClientFees(CLIENT, 800, 0, T0))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_FEE_PARAMS);

        // handing the fee to nobody ends it
        dm.updateClientFeeRecipient(CLIENT, 0, T0);
        assertThat(dm.getFeeParams().clientBps).isZero();
        assertThatThrownBy(() -> dm.updateClientFees(CLIENT, 100, 0, T0))
                .hasFieldOrPropertyWithValue("code", Error.NOT_FEE_RECIPIENT);
    }

    @Test
    void rolesAreGrantedAndRevokedByTheOwner() throws Exception {
        DataModel dm = ledger();

        assertThatThrownBy(() -> dm.grantRoles(AGENT, BOB, AccessControl.ROLE_MANAGER, T0))
                .hasFieldOrPropertyWithValue("code", Error.UNAUTHORIZED);

        dm.grantRoles(OWNER, BOB, AccessControl.ROLE_MANAGER, T0);
        int tier = dm.createTier(BOB, new TierParams(MONTH, PRICE), T0);
        assertThat(tier).isEqualTo(2);

        dm.revokeRoles(OWNER, BOB, AccessControl.ROLE_MANAGER, T0);
        assertThatThrownBy(() -> dm.createTier(BOB, new TierParams(MONTH, PRICE), T0))
                .hasFieldOrPropertyWithValue("code", Error.UNAUTHORIZED);
    }

    @Test
    void ownershipMovesEveryRole() throws Exception {
        DataModel dm = ledger();

        dm.transferOwnership(OWNER, CAROL, T0);

        assertThat(dm.getStats().owner).isEqualTo(CAROL);
        dm.setTierPaused(CAROL, 1, true, T0);
        assertThatThrownBy(() -> dm.setTierPaused(OWNER, 1, false, T0))
                .hasFieldOrPropertyWithValue("code", Error.UNAUTHORIZED);
    }

    @Test
    void accessControlCanLiveOutsideTheLedger() throws Exception {
        InitParams p = params();
        p.accessControl = new AccessControl() {
            private static final long serialVersionUID = 1L;
            @Override
            public boolean isAuthorized(long account, int roles) {
                return account == AGENT;
            }
            @Override
            public long getOwner() {
                return OWNER;
            }
        };
        DataModel dm = new DataModel();
        dm.initialize(p, T0);

        dm.grantTime(AGENT, ALICE, Timestamp.DAY, 0, T0);
        assertThatThrownBy(() -> dm.grantTime(OWNER, ALICE, Timestamp.DAY, 0, T0))
                .hasFieldOrPropertyWithValue("code", Error.UNAUTHORIZED);
        assertThatThrownBy(() -> dm.grantRoles(OWNER, BOB, AccessControl.ROLE_AGENT, T0))
                .hasFieldOrPropertyWithValue("code", Error.UNAUTHORIZED);
    }

    @Test
    void creatorWithdrawsToTheTransferRecipient() throws Exception {
        DataModel dm = ledger();
        fund(dm, ALICE, PRICE);
        fund(dm, CAROL, 1000);
        buy(dm, ALICE, PRICE, T0);
        dm.yieldRewards(CAROL, 1000, 1000, T0);

        assertThatThrownBy(() -> dm.withdraw(ALICE, T0))
                .hasFieldOrPropertyWithValue("code", Error.UNAUTHORIZED);

        dm.setTransferRecipient(OWNER, DAVE, T0);
        assertThat(dm.withdraw(OWNER, T0)).isEqualTo(PRICE);

        assertThat(dm.balanceOf(DAVE)).isEqualTo(PRICE);
        assertThat(dm.creatorBalance()).isZero();
        assertThat(dm.contractBalance()).isEqualTo(1000);
        assertThatThrownBy(() -> dm.withdrawTo(OWNER, BOB, T0))
                .hasFieldOrPropertyWithValue("code", Error.NOTHING_TO_DO);
    }

    @Test
    void tierUpdatesKeepMembers() throws Exception {
        DataModel dm = ledger();
        fund(dm, ALICE, PRICE);
        buy(dm, ALICE, PRICE, T0);

        TierParams cheaper = new TierParams(MONTH, PRICE / 2);
        dm.updateTier(OWNER, 1, cheaper, T0);

        Tier tier = dm.getTier(1);
        assertThat(tier.getPricePerPeriod()).isEqualTo(PRICE / 2);
        assertThat(tier.getSupply()).isEqualTo(1);
        assertThat(dm.remainingSeconds(ALICE, T0)).isEqualTo(MONTH);
        assertThatThrownBy(() -> dm.getTier(2))
                .hasFieldOrPropertyWithValue("code", Error.TIER_NOT_FOUND);
        assertThatThrownBy(() -> dm.updateTier(OWNER, 1, new TierParams(0, PRICE), T0))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_TIER_PARAMS);
    }

    @Test
    void eventsArePagedInOrder() throws Exception {
        DataModel dm = ledger();
        fund(dm, ALICE, 3 * PRICE);
        for (int i = 0; i < 3; ++i)
            buy(dm, ALICE, PRICE, T0 + i);

        long total = dm.getEventCount();
        assertThat(dm.getEvents(0, 2)).hasSize(2);
        assertThat(dm.getEvents(total - 1, 10)).hasSize(1);
        assertThat(dm.getEvents(total, 10)).isEmpty();
        for (LedgerEvent e : dm.getEvents(0, Integer.MAX_VALUE))
            assertThat(e.getSeq()).isLessThan(total);
        assertThat(dm.getEvents(0, 1).get(0).getCode()).isEqualTo(LedgerEvent.INITIALIZED);
    }
}
