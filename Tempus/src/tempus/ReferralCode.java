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
 * A referral code. Looked up at purchase time by its numeric code.
 */
public class ReferralCode implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public final long code;
    
    // Reward paid to the referrer, carved out of the client fee.
    public final int basisPoints;
    
    // Once true the code can never change again.
    public final boolean permanent;
    
    // If non-zero, only this referrer may use the code.
    public final long restrictedAccount;
    
    public ReferralCode(long code, int basisPoints, boolean permanent, long restrictedAccount) {
        this.code = code;
        this.basisPoints = basisPoints;
        this.permanent = permanent;
        this.restrictedAccount = restrictedAccount;
    }
    
    public boolean isUsableBy(long referrer) {
        return (restrictedAccount == 0) || (restrictedAccount == referrer);
    }
}
