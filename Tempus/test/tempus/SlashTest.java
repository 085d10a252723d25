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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tempus.Fixtures.*;

class SlashTest {

    static final long SHARES = 1024;

    DataModel dm;
    long aliceExpiry;

    @BeforeEach
    void setUp() throws Exception {
        InitParams p = params(MONTH, SHARES);
        p.rewards = new RewardParams(true, 7 * Timestamp.DAY);
        dm = ledger(p);
        fund(dm, ALICE, SHARES);
        fund(dm, BOB, 3 * SHARES);
        fund(dm, CAROL, 1000);
        aliceExpiry = buy(dm, ALICE, SHARES, T0).expiresAt;
        buy(dm, BOB, SHARES, T0);
        dm.yieldRewards(CAROL, 1000, 1000, T0);
    }

    @Test
    void lapsedHolderIsSlashableOnlyAfterTheGracePeriod() throws Exception {
        assertThatThrownBy(() -> dm.slash(CAROL, ALICE, aliceExpiry + 6 * Timestamp.DAY))
                .isInstanceOfSatisfying(LedgerException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(Error.NOT_SLASHABLE);
                    assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_ELIGIBLE);
                });
        assertThat(dm.getHolder(ALICE).numShares).isEqualTo(SHARES);

        long paid = dm.slash(CAROL, ALICE, aliceExpiry + 8 * Timestamp.DAY);

        assertThat(paid).isEqualTo(500);
        assertThat(dm.balanceOf(ALICE)).isEqualTo(500);
        assertThat(dm.getHolder(ALICE)).isNull();
        assertThat(dm.getPoolDetail().totalShares).isEqualTo(SHARES);
        assertThat(dm.getPoolDetail().poolBalance).isEqualTo(500);
        assertThat(dm.rewardBalanceOf(BOB)).isEqualTo(500);
        assertThat(sumOfShares(dm)).isEqualTo(dm.getPoolDetail().totalShares);
        assertThat(dm.getEvents(dm.getEventCount() - 1, 1))
                .extracting(LedgerEvent::getCode)
                .containsExactly(LedgerEvent.SLASHED);
    }

    @Test
    void rejectedPayoutStaysInThePoolForTheOthers() throws Exception {
        dm.getAssetBook().setRejecting(ALICE, true);

        long amount = dm.slash(CAROL, ALICE, aliceExpiry + 8 * Timestamp.DAY);

        assertThat(amount).isEqualTo(500);
        assertThat(dm.balanceOf(ALICE)).isZero();
        assertThat(dm.getHolder(ALICE)).isNull();
        assertThat(dm.getPoolDetail().poolBalance).isEqualTo(1000);
        assertThat(dm.rewardBalanceOf(BOB)).isEqualTo(1000);
        assertThat(dm.getEvents(dm.getEventCount() - 1, 1))
                .extracting(LedgerEvent::getCode)
                .containsExactly(LedgerEvent.SLASH_TRANSFER_FALLBACK);
    }

    @Test
    void rejectedPayoutOfTheLastHolderGoesBackToTheCreator() throws Exception {
        long lapsed = aliceExpiry + 8 * Timestamp.DAY;
        dm.slash(CAROL, ALICE, lapsed);
        dm.getAssetBook().setRejecting(BOB, true);
        long creatorBefore = dm.creatorBalance();

        long amount = dm.slash(CAROL, BOB, lapsed);

        assertThat(amount).isEqualTo(500);
        assertThat(dm.getPoolDetail().totalShares).isZero();
        assertThat(dm.getPoolDetail().poolBalance).isZero();
        assertThat(dm.creatorBalance()).isEqualTo(creatorBefore + 500);
        assertConserved(dm, 4 * SHARES + 1000);
        assertThat(dm.withdraw(OWNER, lapsed)).isEqualTo(creatorBefore + 500);
    }

    @Test
    void renewedHolderIsNoLongerSlashable() throws Exception {
        buy(dm, BOB, SHARES, aliceExpiry + 8 * Timestamp.DAY);

        assertThatThrownBy(() -> dm.slash(CAROL, BOB, aliceExpiry + 9 * Timestamp.DAY))
                .hasFieldOrPropertyWithValue("code", Error.NOT_SLASHABLE);
    }

    @Test
    void slashingTwiceHasNothingToDo() throws Exception {
        dm.slash(CAROL, ALICE, aliceExpiry + 8 * Timestamp.DAY);

        assertThatThrownBy(() -> dm.slash(CAROL, ALICE, aliceExpiry + 8 * Timestamp.DAY))
                .hasFieldOrPropertyWithValue("code", Error.NOTHING_TO_DO);
    }

    @Test
    void slashingCanBeTurnedOffButNotBackOn() throws Exception {
        assertThatThrownBy(() -> dm.setRewardParams(ALICE, false, 0, T0))
                .hasFieldOrPropertyWithValue("code", Error.UNAUTHORIZED);

        dm.setRewardParams(OWNER, false, 7 * Timestamp.DAY, T0);

        assertThatThrownBy(() -> dm.slash(CAROL, ALICE, aliceExpiry + 30 * Timestamp.DAY))
                .hasFieldOrPropertyWithValue("code", Error.NOT_SLASHABLE);
        assertThatThrownBy(() -> dm.setRewardParams(OWNER, true, 7 * Timestamp.DAY, T0))
                .hasFieldOrPropertyWithValue("code", Error.INVALID_REWARD_PARAMS);
        assertThat(dm.getPoolDetail().slashable).isFalse();
    }

    @Test
    void holdersWithoutASubscriptionAreSlashableRightAway() throws Exception {
        dm.issueRewardShares(ISSUER, DAVE, SHARES, T0);

        // never subscribed: expiry is the epoch, long past the grace period
        assertThat(dm.slash(CAROL, DAVE, T0)).isZero();
        assertThat(dm.getPoolDetail().totalShares).isEqualTo(2 * SHARES);
    }
}
