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
 * Everything a fresh ledger is initialized with.
 */
public class InitParams implements Serializable {
    private static final long serialVersionUID = 1L;
    
    // Holds every role. Required.
    public long owner;
    
    // Authorization gate. A RoleTable for the owner if left null.
    public AccessControl accessControl;
    
    public Currency currency = new NativeCurrency();
    
    // Becomes tier 1. Its rewardCurveId must be 0.
    public TierParams tier = new TierParams(Main.DEFAULT_PERIOD_SECONDS, Main.DEFAULT_PRICE_PER_PERIOD);
    
    // Becomes curve 0.
    public CurveParams curve = CurveParams.flat();
    
    public FeeParams fees = new FeeParams();
    
    public RewardParams rewards = new RewardParams(true, Main.DEFAULT_SLASH_GRACE_SECONDS);
    
    // 0 for no limit
    public long globalSupplyCap;
    
    public InitParams() {
    }
    
    public InitParams(long owner) {
        this.owner = owner;
    }
}
