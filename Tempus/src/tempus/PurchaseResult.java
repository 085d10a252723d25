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
 * Outcome of a purchase.
 */
public class PurchaseResult implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public final long tokenId;
    
    // What stayed in the ledger after every fee leg.
    public final long netAmount;
    
    public final long sharesIssued;
    
    public final long expiresAt;
    
    public PurchaseResult(long tokenId, long netAmount, long sharesIssued, long expiresAt) {
        this.tokenId = tokenId;
        this.netAmount = netAmount;
        this.sharesIssued = sharesIssued;
        this.expiresAt = expiresAt;
    }
}
