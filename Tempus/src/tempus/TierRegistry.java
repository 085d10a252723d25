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
import java.util.ArrayList;

/**
 * All tiers, by id. Tiers are never removed.
 */
public class TierRegistry implements Serializable {
    private static final long serialVersionUID = 1L;
    
    // tier id N is at index N-1
    ArrayList<Tier> tiers = new ArrayList<>();
    
    //==================================================================
    
    static void validate(TierParams params, int numCurves) throws LedgerException {
        if (params.periodDurationSeconds <= 0)
            throw new LedgerException(Error.INVALID_TIER_PARAMS, "period duration must be > 0");
        if (params.pricePerPeriod < 0 || params.initialMintPrice < 0 || params.maxSupply < 0 
                || params.maxCommitmentSeconds < 0 || params.startTimestamp < 0 || params.endTimestamp < 0)
            throw new LedgerException(Error.INVALID_TIER_PARAMS, "negative value");
        if (params.rewardCurveId < 0 || params.rewardCurveId >= numCurves)
            throw new LedgerException(Error.INVALID_TIER_PARAMS, "unknown reward curve " + params.rewardCurveId);
        if (params.rewardBasisPoints < 0 || params.rewardBasisPoints > Main.MAX_BPS)
            throw new LedgerException(Error.INVALID_TIER_PARAMS, "reward bps " + params.rewardBasisPoints);
        if (params.endTimestamp != 0 && params.endTimestamp <= params.startTimestamp)
            throw new LedgerException(Error.INVALID_TIER_PARAMS, "tier ends before it starts");
        if (params.maxCommitmentSeconds != 0 && params.maxCommitmentSeconds < params.periodDurationSeconds)
            throw new LedgerException(Error.INVALID_TIER_PARAMS, "max commitment shorter than one period");
    }
    
    //==================================================================
    
    public int createTier(TierParams params, int numCurves) throws LedgerException {
        validate(params, numCurves);
        if (tiers.size() >= Main.MAX_TIERS)
            throw new LedgerException(Error.INVALID_TIER_PARAMS, "too many tiers");
        int id = tiers.size() + 1;
        tiers.add(new Tier(id, params));
        return id;
    }
    
    // Full overwrite of the parameters. The member count is kept.
    public void updateTier(int id, TierParams params, int numCurves) throws LedgerException {
        Tier tier = getTier(id);
        validate(params, numCurves);
        if (params.maxSupply != 0 && params.maxSupply < tier.supply)
            throw new LedgerException(Error.INVALID_TIER_PARAMS, 
                    "max supply " + params.maxSupply + " below current supply " + tier.supply);
        tier.params = params.copy();
    }
    
    // Returns false if the tier was already in that state.
    public boolean setPaused(int id, boolean paused) throws LedgerException {
        Tier tier = getTier(id);
        if (tier.params.paused == paused)
            return false;
        tier.params.paused = paused;
        return true;
    }
    
    public Tier getTier(int id) throws LedgerException {
        Tier tier = findTier(id);
        if (tier == null)
            throw new LedgerException(Error.TIER_NOT_FOUND, "tier " + id);
        return tier;
    }
    
    public Tier findTier(int id) {
        if (id < 1 || id > tiers.size())
            return null;
        return tiers.get(id - 1);
    }
    
    public int getTierCount() {
        return tiers.size();
    }
    
    //==================================================================
    // Membership accounting
    //==================================================================
    
    void checkJoin(Tier tier) throws LedgerException {
        if (tier.isFull())
            throw new LedgerException(Error.TIER_SUPPLY_EXCEEDED, 
                    "tier " + tier.id + " is at its supply cap of " + tier.params.maxSupply);
    }
    
    void join(Tier tier) {
        ++tier.supply;
    }
    
    void leave(Tier tier) {
        if (tier.supply > 0)
            --tier.supply;
    }
}
