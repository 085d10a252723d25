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
 * A tier subscribers join: its parameters plus its live member count.
 */
public class Tier implements Serializable {
    private static final long serialVersionUID = 1L;
    
    // 1-based. Tier 0 means "no tier".
    public final int id;
    
    TierParams params;
    
    // Number of accounts currently holding this tier.
    long supply;
    
    Tier(int id, TierParams params) {
        this.id = id;
        this.params = params.copy();
    }
    
    public TierParams getParams() { return params.copy(); }
    public long getSupply() { return supply; }
    public boolean isPaused() { return params.paused; }
    public boolean isTransferable() { return params.transferable; }
    public long getPeriodDurationSeconds() { return params.periodDurationSeconds; }
    public long getPricePerPeriod() { return params.pricePerPeriod; }
    public int getRewardCurveId() { return params.rewardCurveId; }
    public int getRewardBasisPoints() { return params.rewardBasisPoints; }
    
    public boolean isFull() {
        return (params.maxSupply > 0) && (supply >= params.maxSupply);
    }
    
    public Tier copy() {
        Tier t = new Tier(id, params);
        t.supply = supply;
        return t;
    }
}
