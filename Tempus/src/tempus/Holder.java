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
import java.math.BigInteger;

/**
 * A reward pool participant.
 */
public class Holder implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public long numShares;
    
    // Offsets the points-per-share that accrued before these shares 
    //   existed, so they only earn on allocations made after issuance.
    BigInteger pointsCorrection = BigInteger.ZERO;
    
    // Value already paid out (the claim checkpoint).
    public long rewardsWithdrawn;
    
    public Holder copy() {
        Holder h = new Holder();
        h.numShares = numShares;
        h.pointsCorrection = pointsCorrection;
        h.rewardsWithdrawn = rewardsWithdrawn;
        return h;
    }
}
