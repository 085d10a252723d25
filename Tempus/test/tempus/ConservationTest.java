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

import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static tempus.Fixtures.*;

/**
 * Drives a ledger through a long random mix of operations and checks 
 *   after every step that no value appeared or vanished, and that a 
 *   refused operation changed nothing.
 */
class ConservationTest {

    static final long[] USERS = { ALICE, BOB, CAROL, DAVE, REFERRER };

    @Test
    void randomOperationsConserveValueAndShares() throws Exception {
        InitParams p = params();
        p.fees = new FeeParams(PROTOCOL, 300, CLIENT, 400, 100);
        p.tier.rewardBasisPoints = 2000;
        DataModel dm = ledger(p);
        int curve = dm.createRewardCurve(OWNER, new CurveParams(DecayFormula.EXPONENTIAL, 2, 6, 5 * Timestamp.DAY, 1), T0);
        TierParams premium = new TierParams(MONTH, 3 * PRICE);
        premium.rewardCurveId = curve;
        premium.rewardBasisPoints = 5000;
        premium.maxSupply = 3;
        premium.initialMintPrice = PRICE / 10;
        int premiumTier = dm.createTier(OWNER, premium, T0);
        dm.setReferralCode(OWNER, 1, 300, false, REFERRER, T0);

        long deposited = 0;
        for (long user : USERS) {
            fund(dm, user, 1000 * PRICE);
            deposited += 1000 * PRICE;
        }

        Random random = new Random(42);
        long now = T0;
        int succeeded = 0;
        for (int step = 0; step < 3000; ++step) {
            now += random.nextInt(2 * (int) Timestamp.DAY);
            long a = USERS[random.nextInt(USERS.length)];
            long b = USERS[random.nextInt(USERS.length)];
            LedgerStats before = dm.getStats();
            long sharesBefore = dm.getPoolDetail().totalShares;
            try {
                switch (random.nextInt(12)) {
                    case 0:
                    case 1: {
                        int tier = random.nextBoolean() ? 0 : premiumTier;
                        long amount = (1 + random.nextInt(3)) * PRICE * (tier == 0 ? 1 : 3) + random.nextInt(1000);
                        boolean referred = random.nextBoolean();
                        dm.purchase(a, a, tier, amount, amount, referred ? 1 : 0, referred ? REFERRER : 0, now);
                        break;
                    }
                    case 2: {
                        long amount = 1 + random.nextInt((int) PRICE);
                        dm.yieldRewards(a, amount, amount, now);
                        break;
                    }
                    case 3:
                        dm.claimRewards(a, now);
                        break;
                    case 4:
                        dm.slash(b, a, now);
                        break;
                    case 5:
                        dm.refund(AGENT, a, random.nextInt((int) PRICE), now);
                        break;
                    case 6:
                        dm.grantTime(AGENT, a, 1 + random.nextInt((int) Timestamp.DAY * 10), 0, now);
                        break;
                    case 7:
                        dm.revokeTime(AGENT, a, now);
                        break;
                    case 8:
                        dm.deactivateSubscription(a, now);
                        break;
                    case 9:
                        dm.transferSubscription(a, b, now);
                        break;
                    case 10:
                        if (random.nextInt(4) == 0)
                            dm.withdrawTo(OWNER, b, now);
                        else
                            dm.getAssetBook().setRejecting(a, random.nextInt(3) == 0);
                        break;
                    default:
                        dm.issueRewardShares(ISSUER, a, 1 + random.nextInt(1000), now);
                        break;
                }
                ++succeeded;
            } catch (LedgerException e) {
                LedgerStats after = dm.getStats();
                assertThat(after.heldBalance).as("held after %s", e).isEqualTo(before.heldBalance);
                assertThat(after.poolBalance).as("pool after %s", e).isEqualTo(before.poolBalance);
                assertThat(after.subCount).as("subs after %s", e).isEqualTo(before.subCount);
                assertThat(after.eventCount).as("events after %s", e).isEqualTo(before.eventCount);
                assertThat(dm.getPoolDetail().totalShares).isEqualTo(sharesBefore);
            }
            assertConserved(dm, deposited);
            assertThat(dm.getTier(premiumTier).getSupply()).isLessThanOrEqualTo(3);
        }
        assertThat(succeeded).isGreaterThan(1000);
        assertThat(dm.busy).isFalse();
    }
}
