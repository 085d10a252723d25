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

/**
 * The configurable part of a tier, as supplied to createTier/updateTier.
 */
public class TierParams implements Serializable, Cloneable {
    private static final long serialVersionUID = 1L;
    
    // Length of one billing period. Must be > 0.
    public long periodDurationSeconds;
    
    // Price of one period. Zero makes the tier free (one period per join).
    public long pricePerPeriod;
    
    // Surcharge on an account's very first purchase.
    public long initialMintPrice;
    
    // Maximum number of concurrent members, 0 for no limit.
    public long maxSupply;
    
    // Upper bound on time remaining after a purchase, 0 for no limit.
    public long maxCommitmentSeconds;
    
    // Purchases before this time are refused.
    public long startTimestamp;
    
    // Purchases may not extend expiry beyond this time, 0 for never.
    public long endTimestamp;
    
    // Curve used to convert this tier's payments into reward shares.
    public int rewardCurveId;
    
    // Share of each net payment allocated to the reward pool.
    public int rewardBasisPoints;
    
    public boolean paused;
    
    public boolean transferable = true;
    
    public TierParams() {
    }
    
    public TierParams(long periodDurationSeconds, long pricePerPeriod) {
        this.periodDurationSeconds = periodDurationSeconds;
        this.pricePerPeriod = pricePerPeriod;
    }
    
    public TierParams copy() {
        try {
            return (TierParams) clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException(e); // never happens
        }
    }
}
