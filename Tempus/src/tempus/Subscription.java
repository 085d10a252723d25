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
 * One account's subscription record.
 */
public class Subscription implements Serializable {
    private static final long serialVersionUID = 1L;
    
    // Identity token bound to this record. 0 if none was ever minted.
    public long tokenId;
    
    // Current tier. 0 means no tier membership, even if tokenId != 0.
    public int tierId;
    
    // Absolute time when access ends.
    public long expiresAt;
    
    // Outstanding seconds that were granted without payment.
    public long grantedSeconds;
    
    // Absolute time when the paid portion of the access ends.
    public long purchaseExpires;
    
    // Lifetime total of seconds paid for.
    public long purchasedSeconds;
    
    public long remainingSeconds(long now) {
        return Math.max(0, expiresAt - now);
    }
    
    public long remainingPaidSeconds(long now) {
        return Math.max(0, purchaseExpires - now);
    }
    
    public boolean isActive(long now) {
        return (tierId != 0) && (expiresAt > now);
    }
    
    public Subscription copy() {
        Subscription s = new Subscription();
        s.tokenId = tokenId;
        s.tierId = tierId;
        s.expiresAt = expiresAt;
        s.grantedSeconds = grantedSeconds;
        s.purchaseExpires = purchaseExpires;
        s.purchasedSeconds = purchasedSeconds;
        return s;
    }
}
