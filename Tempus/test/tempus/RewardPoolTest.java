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

class RewardPoolTest {

    // Power-of-two share counts keep the points-per-share math exact.
    static final long SHARES = 1024;

    private DataModel ledgerWithTwoHolders() throws Exception {
        DataModel dm = ledger(params(MONTH, SHARES));
        fund(dm, ALICE, SHARES);
        fund(dm, BOB, SHARES);
        fund(dm, CAROL, 100000);
        buy(dm, ALICE, SHARES, T0);
        buy(dm, BOB, SHARES, T0);
        return dm;
    }

    @Test
    void yieldIsSplitByShares() throws Exception {
        DataModel dm = ledgerWithTwoHolders();

        dm.yieldRewards(CAROL, 1000, 1000, T0);

        assertThat(dm.rewardBalanceOf(ALICE)).isEqualTo(500);
        assertThat(dm.rewardBalanceOf(BOB)).isEqualTo(500);
        assertThat(dm.getPoolDetail().poolBalance).isEqualTo(1000);
        assertThat(dm.creatorBalance()).isEqualTo(2 * SHARES);
    }

    @Test
    void secondClaimPaysNothing() throws Exception {
        DataModel dm = ledgerWithTwoHolders();
        dm.yieldRewards(CAROL, 1000, 1000, T0);

        assertThat(dm.claimRewards(ALICE, T0)).isEqualTo(500);
        assertThat(dm.claimRewards(ALICE, T0)).isZero();

        assertThat(dm.balanceOf(ALICE)).isEqualTo(500);
        assertThat(dm.getPoolDetail().poolBalance).isEqualTo(500);
        assertThat(dm.getPoolDetail().totalWithdrawn).isEqualTo(500);
    }

    @Test
    void anyoneCanTriggerAClaimButTheHolderIsPaid() throws Exception {
        DataModel dm = ledgerWithTwoHolders();
        dm.yieldRewards(CAROL, 1000, 1000, T0);
        long carolBefore = dm.balanceOf(CAROL);

        // claimRewards takes no caller: the payout always goes to the holder
        dm.claimRewards(BOB, T0);

        assertThat(dm.balanceOf(BOB)).isEqualTo(500);
        assertThat(dm.balanceOf(CAROL)).isEqualTo(carolBefore);
    }

    @Test
    void newSharesDoNotDiluteEarlierAllocations() throws Exception {
        DataModel dm = ledgerWithTwoHolders();
        dm.yieldRewards(CAROL, 1000, 1000, T0);
        fund(dm, DAVE, 2 * SHARES);

        buy(dm, DAVE, 2 * SHARES, T0);

        assertThat(dm.rewardBalanceOf(DAVE)).isZero();
        assertThat(dm.rewardBalanceOf(ALICE)).isEqualTo(500);

        dm.yieldRewards(CAROL, 4096, 4096, T0);
        assertThat(dm.rewardBalanceOf(DAVE)).isEqualTo(2048);
        assertThat(dm.rewardBalanceOf(ALICE)).isEqualTo(500 + 1024);
    }

    @Test
    void purchaseRewardsGoToExistingHoldersBeforeTheBuyerJoins() throws Exception {
        InitParams p = params(MONTH, SHARES);
        p.tier.rewardBasisPoints = 5000;
        DataModel dm = ledger(p);
        fund(dm, ALICE, SHARES);
        fund(dm, BOB, 2 * SHARES);

        // nobody to reward yet: the reward portion stays with the creator
        buy(dm, ALICE, SHARES, T0);
        assertThat(dm.getPoolDetail().poolBalance).isZero();
        assertThat(dm.creatorBalance()).isEqualTo(SHARES);

        PurchaseResult r = buy(dm, BOB, 2 * SHARES, T0);

        assertThat(r.sharesIssued).isEqualTo(2 * SHARES);
        assertThat(dm.rewardBalanceOf(ALICE)).isEqualTo(SHARES);
        assertThat(dm.rewardBalanceOf(BOB)).isZero();
        assertThat(dm.creatorBalance()).isEqualTo(2 * SHARES);
    }

    @Test
    void yieldNeedsShareholders() throws Exception {
        DataModel dm = ledger();
        fund(dm, CAROL, 1000);

        assertThatThrownBy(() -> dm.yieldRewards(CAROL, 1000, 1000, T0))
                .hasFieldOrPropertyWithValue("code", Error.POOL_EMPTY);
        assertThatThrownBy(() -> dm.yieldRewards(CAROL, 0, 0, T0))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_AMOUNT);
        assertThat(dm.balanceOf(CAROL)).isEqualTo(1000);
    }

    @Test
    void issuerHandsOutSharesWithoutPayment() throws Exception {
        DataModel dm = ledger();
        fund(dm, CAROL, 1000);

        assertThatThrownBy(() -> dm.issueRewardShares(ALICE, ALICE, 10, T0))
                .isInstanceOfSatisfying(LedgerException.class, 
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.AUTHORIZATION));

        dm.issueRewardShares(ISSUER, DAVE, 10, T0);
        dm.yieldRewards(CAROL, 1000, 1000, T0);

        assertThat(dm.getPoolDetail().totalShares).isEqualTo(10);
        assertThat(dm.rewardBalanceOf(DAVE)).isEqualTo(1000);
        assertThat(sumOfShares(dm)).isEqualTo(dm.getPoolDetail().totalShares);
    }

    @Test
    void curveMultiplierNeverIncreases() throws Exception {
        DataModel dm = ledger();
        int exp = dm.createRewardCurve(OWNER, new CurveParams(DecayFormula.EXPONENTIAL, 2, 4, Timestamp.DAY, 1), T0);
        int lin = dm.createRewardCurve(OWNER, new CurveParams(DecayFormula.LINEAR, 3, 5, Timestamp.DAY, 2), T0);

        RewardCurve e = dm.getCurve(exp);
        assertThat(e.multiplier(T0)).isEqualTo(16);
        assertThat(e.multiplier(T0 + Timestamp.DAY)).isEqualTo(8);
        assertThat(e.multiplier(T0 + 4 * Timestamp.DAY)).isEqualTo(1);

        RewardCurve l = dm.getCurve(lin);
        assertThat(l.multiplier(T0)).isEqualTo(15);
        assertThat(l.multiplier(T0 + 4 * Timestamp.DAY)).isEqualTo(3);
        assertThat(l.multiplier(T0 + 5 * Timestamp.DAY)).isEqualTo(2);

        for (RewardCurve c : new RewardCurve[] { e, l }) {
            long previous = Long.MAX_VALUE;
            for (long t = T0 - Timestamp.DAY; t < T0 + 10 * Timestamp.DAY; t += Timestamp.HOUR) {
                long shares = c.sharesFor(1000, t);
                assertThat(shares).isLessThanOrEqualTo(previous);
                previous = shares;
            }
        }
    }

    @Test
    void earlyBuyersGetMoreSharesOnADecayingTier() throws Exception {
        DataModel dm = ledger();
        int curve = dm.createRewardCurve(OWNER, new CurveParams(DecayFormula.EXPONENTIAL, 2, 3, MONTH, 1), T0);
        TierParams early = new TierParams(MONTH, PRICE);
        early.rewardCurveId = curve;
        int tier = dm.createTier(OWNER, early, T0);
        fund(dm, ALICE, PRICE);
        fund(dm, BOB, PRICE);

        long aliceShares = buy(dm, ALICE, tier, PRICE, T0).sharesIssued;
        long bobShares = buy(dm, BOB, tier, PRICE, T0 + MONTH).sharesIssued;

        assertThat(aliceShares).isEqualTo(8 * PRICE);
        assertThat(bobShares).isEqualTo(4 * PRICE);
    }

    @Test
    void curvesAreValidatedAndAppendOnly() throws Exception {
        DataModel dm = ledger();

        assertThatThrownBy(() -> dm.createRewardCurve(OWNER, new CurveParams(DecayFormula.EXPONENTIAL, 2, 4, 0, 1), T0))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_CURVE_PARAMS);
        assertThatThrownBy(() -> dm.createRewardCurve(OWNER, new CurveParams(DecayFormula.EXPONENTIAL, 1000, 200, 1, 1), T0))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_CURVE_PARAMS);
        assertThat(dm.getPoolDetail().numCurves).isEqualTo(1);

        TierParams bad = new TierParams(MONTH, PRICE);
        bad.rewardCurveId = 1;
        assertThatThrownBy(() -> dm.createTier(OWNER, bad, T0))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_TIER_PARAMS);
        assertThatThrownBy(() -> dm.getCurve(1))
                .hasFieldOrPropertyWithValue("code", Error.CURVE_NOT_FOUND);
    }
}
