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
 * Referral codes by code number.
 */
public class ReferralRegistry implements Serializable {
    private static final long serialVersionUID = 1L;
    
    HashMap<Long, ReferralCode> codes = new HashMap<>();
    
    public ReferralCode getCode(long code) {
        return codes.get(code);
    }
    
    // bpsCeiling is the client fee: referrals are paid out of it.
    void setCode(long code, int bps, boolean permanent, long restrictedAccount, int bpsCeiling) 
            throws LedgerException 
    {
        if (bps < 0 || bps > bpsCeiling)
            throw new LedgerException(Error.INVALID_REFERRAL_PARAMS, 
                    "referral bps " + bps + " exceeds ceiling " + bpsCeiling);
        if (restrictedAccount < 0)
            throw new LedgerException(Error.INVALID_ACCOUNT);
        checkMutable(code);
        codes.put(code, new ReferralCode(code, bps, permanent, restrictedAccount));
    }
    
    void deleteCode(long code) throws LedgerException {
        if (! codes.containsKey(code))
            throw new LedgerException(Error.NOTHING_TO_DO, "no referral code " + code);
        checkMutable(code);
        codes.remove(code);
    }
    
    private void checkMutable(long code) throws LedgerException {
        ReferralCode existing = codes.get(code);
        if (existing != null && existing.permanent)
            throw new LedgerException(Error.REFERRAL_LOCKED, "referral code " + code + " is permanent");
    }
    
    // Referral reward, in bps, for a purchase routed through referrer 
    //   with the given code. No referrer: nothing. A code that doesn't 
    //   resolve to a reward for this referrer falls back to the fee 
    //   structure's client-referral bps. Never more than the client fee.
    int resolveBps(long code, long referrer, FeeParams fees) {
        if (referrer == 0 || fees.clientRecipient == 0)
            return 0;
        int bps = 0;
        ReferralCode rc = codes.get(code);
        if (rc != null && rc.isUsableBy(referrer))
            bps = rc.basisPoints;
        if (bps == 0)
            bps = fees.clientReferralBps;
        return Math.min(bps, fees.clientBps);
    }
}
