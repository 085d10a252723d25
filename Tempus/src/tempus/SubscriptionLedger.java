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

import java.io.Serializable;
import java.util.HashMap;

/**
 * Per-account subscription records and the time arithmetic on them.
 * 
 * The planning methods (tokensToSeconds, extend*, convertTier, ...) work 
 *   on a copy of a record and never touch stored state; the caller checks 
 *   everything on the copy and then store()s it. That's how an operation 
 *   either completes fully or changes nothing.
 */
public class SubscriptionLedger implements Serializable {
    private static final long serialVersionUID = 1L;
    
    // All records by account.
    HashMap<Long, Subscription> subscriptions = new HashMap<>();
    
    // Last token id handed out. Ids are never reused.
    long tokenIdCounter;
    
    // Number of minted subscriptions.
    long subCount;
    
    // Cap on subCount, 0 for none.
    long supplyCap;
    
    //==================================================================
    
    public Subscription find(long account) {
        return subscriptions.get(account);
    }
    
    // Copy of the stored record, or a blank one.
    public Subscription copyOf(long account) {
        Subscription sub = subscriptions.get(account);
        return (sub == null) ? new Subscription() : sub.copy();
    }
    
    void store(long account, Subscription sub) {
        subscriptions.put(account, sub);
    }
    
    Subscription remove(long account) {
        return subscriptions.remove(account);
    }
    
    public long getSubCount() { return subCount; }
    public long getSupplyCap() { return supplyCap; }
    public long getTokenIdCounter() { return tokenIdCounter; }
    
    //==================================================================
    // Minting
    //==================================================================
    
    void checkMint() throws LedgerException {
        if (supplyCap > 0 && subCount >= supplyCap)
            throw new LedgerException(Error.GLOBAL_SUPPLY_EXCEEDED, 
                    "global supply cap of " + supplyCap + " reached");
    }
    
    // Hands out the next token id. Caller has called checkMint().
    long mint() {
        ++subCount;
        return ++tokenIdCounter;
    }
    
    void setSupplyCap(long cap) throws LedgerException {
        if (cap < 0 || (cap != 0 && cap < subCount))
            throw new LedgerException(Error.INVALID_SUPPLY_CAP, 
                    "cap " + cap + " below current supply " + subCount);
        supplyCap = cap;
    }
    
    //==================================================================
    // Planning (pure)
    //==================================================================
    
    // Seconds bought by tokensIn on a tier. The initial mint price is 
    //   charged only if the record has never been paid for.
    public static long tokensToSeconds(Tier tier, Subscription sub, long tokensIn) throws LedgerException {
        TierParams p = tier.params;
        long mintPrice = (sub.purchasedSeconds == 0) ? p.initialMintPrice : 0;
        if (tokensIn < mintPrice)
            throw new LedgerException(Error.PURCHASE_TOO_SMALL, 
                    "amount " + tokensIn + " does not cover the initial mint price " + mintPrice);
        long tokens = tokensIn - mintPrice;
        if (p.pricePerPeriod == 0) {
            if (tokens != 0)
                throw new LedgerException(Error.INVALID_AMOUNT, "tier " + tier.id + " is free");
            return p.periodDurationSeconds;
        }
        if (tokens < p.pricePerPeriod)
            throw new LedgerException(Error.PURCHASE_TOO_SMALL, 
                    "amount " + tokens + " buys less than one period at " + p.pricePerPeriod);
        return Bps.mulDiv(tokens, p.periodDurationSeconds, p.pricePerPeriod);
    }
    
    // Paid extension.
    static void extendPaid(Subscription sub, long seconds, long now) throws LedgerException {
        sub.expiresAt = Bps.add(Math.max(now, sub.expiresAt), seconds);
        sub.purchaseExpires = Bps.add(Math.max(now, sub.purchaseExpires), seconds);
        sub.purchasedSeconds = Bps.add(sub.purchasedSeconds, seconds);
    }
    
    // Unpaid extension.
    static void extendGranted(Subscription sub, long seconds, long now) throws LedgerException {
        sub.expiresAt = Bps.add(Math.max(now, sub.expiresAt), seconds);
        sub.grantedSeconds = Bps.add(sub.grantedSeconds, seconds);
    }
    
    // Re-prices the remaining time when moving between tiers, so that the 
    //   value left on the old tier buys its worth on the new one.
    static void convertTier(Subscription sub, Tier from, Tier to, long now) throws LedgerException {
        if (from != null && from.id != to.id) {
            long remaining = sub.remainingSeconds(now);
            long paid = Math.min(remaining, sub.remainingPaidSeconds(now));
            long priceFrom = from.params.pricePerPeriod;
            long priceTo = to.params.pricePerPeriod;
            if (remaining > 0 && priceFrom != 0 && priceTo != 0) {
                // seconds * price/duration on one side, back into seconds on the other
                long convertedRemaining = Bps.mulDiv(
                        Bps.mulDiv(remaining, priceFrom, from.params.periodDurationSeconds),
                        to.params.periodDurationSeconds, priceTo);
                long convertedPaid = Bps.mulDiv(
                        Bps.mulDiv(paid, priceFrom, from.params.periodDurationSeconds),
                        to.params.periodDurationSeconds, priceTo);
                sub.expiresAt = Bps.add(now, convertedRemaining);
                sub.purchaseExpires = (convertedPaid > 0) ? Bps.add(now, convertedPaid) : Math.min(sub.purchaseExpires, now);
                sub.grantedSeconds = Math.min(sub.grantedSeconds, convertedRemaining - convertedPaid);
            }
        }
        sub.tierId = to.id;
    }
    
    // Time remaining after a purchase must respect the tier's window.
    static void checkCommitment(Subscription sub, Tier tier, long now) throws LedgerException {
        TierParams p = tier.params;
        if (p.maxCommitmentSeconds > 0 && sub.expiresAt - now > p.maxCommitmentSeconds)
            throw new LedgerException(Error.MAX_COMMITMENT_EXCEEDED, 
                    (sub.expiresAt - now) + "s remaining, tier " + tier.id + " allows " + p.maxCommitmentSeconds);
        if (p.endTimestamp > 0 && sub.expiresAt > p.endTimestamp)
            throw new LedgerException(Error.TIER_ENDED, 
                    "expiry " + sub.expiresAt + " beyond tier end " + p.endTimestamp);
    }
    
    // Removes granted time only; paid time is never revoked.
    // Returns the number of seconds removed.
    static long revokeGranted(Subscription sub, long now) {
        long before = sub.expiresAt;
        long target = Math.max(now, Math.max(sub.expiresAt - sub.grantedSeconds, sub.purchaseExpires));
        sub.expiresAt = Math.min(sub.expiresAt, target);
        sub.grantedSeconds = 0;
        return before - sub.expiresAt;
    }
    
    // Removes the paid time worth numTokens on the given tier, or all 
    //   remaining paid time if the tier is free or numTokens covers it.
    // Returns the number of seconds removed.
    static long refundPaid(Subscription sub, Tier tier, long numTokens, long now) throws LedgerException {
        long paid = sub.remainingPaidSeconds(now);
        long remove = paid;
        if (tier != null && tier.params.pricePerPeriod > 0) {
            long worth = Bps.mulDiv(numTokens, tier.params.periodDurationSeconds, tier.params.pricePerPeriod);
            remove = Math.min(paid, worth);
        }
        if (remove == 0)
            return 0;
        sub.purchaseExpires = Math.max(now, sub.purchaseExpires - remove);
        sub.expiresAt = Math.max(now, sub.expiresAt - remove);
        return remove;
    }
}
