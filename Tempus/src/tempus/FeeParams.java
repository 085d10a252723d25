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
 * Who gets a cut of every purchase, and how much.
 * A zero recipient has zero bps and vice versa (normalize() enforces it).
 */
public class FeeParams implements Serializable, Cloneable {
    private static final long serialVersionUID = 1L;
    
    public long protocolRecipient;
    public int protocolBps;
    
    public long clientRecipient;
    public int clientBps;
    
    // Referral reward used when a referral resolves to zero bps.
    public int clientReferralBps;
    
    public FeeParams() {
    }
    
    public FeeParams(long protocolRecipient, int protocolBps, long clientRecipient, int clientBps, int clientReferralBps) {
        this.protocolRecipient = protocolRecipient;
        this.protocolBps = protocolBps;
        this.clientRecipient = clientRecipient;
        this.clientBps = clientBps;
        this.clientReferralBps = clientReferralBps;
    }
    
    void normalize() {
        if (protocolRecipient == 0 || protocolBps == 0) {
            protocolRecipient = 0;
            protocolBps = 0;
        }
        if (clientRecipient == 0 || clientBps == 0) {
            clientRecipient = 0;
            clientBps = 0;
            clientReferralBps = 0;
        }
    }
    
    void validate() throws LedgerException {
        if (protocolBps < 0 || clientBps < 0 || clientReferralBps < 0)
            throw new LedgerException(Error.INVALID_FEE_PARAMS, "negative bps");
        if (protocolRecipient < 0 || clientRecipient < 0)
            throw new LedgerException(Error.INVALID_ACCOUNT);
        if (protocolBps + clientBps > Main.MAX_FEE_BPS)
            throw new LedgerException(Error.INVALID_FEE_PARAMS, 
                    "protocol + client bps " + (protocolBps + clientBps) + " > " + Main.MAX_FEE_BPS);
        if (clientReferralBps > clientBps)
            throw new LedgerException(Error.INVALID_FEE_PARAMS, "client referral bps above client bps");
    }
    
    // Splits a payment. Protocol first, on the gross amount. The referral 
    //   is paid on what is left after the protocol fee, and the client's 
    //   own fee shrinks by the referral bps.
    public FeeSplit split(long amount, int referralBps) {
        FeeSplit split = new FeeSplit();
        split.amount = amount;
        split.referralBps = referralBps;
        split.protocolFee = Bps.of(amount, protocolBps);
        split.referralFee = Bps.of(amount - split.protocolFee, referralBps);
        split.clientFee = Bps.of(amount, clientBps - referralBps);
        split.net = amount - split.protocolFee - split.clientFee - split.referralFee;
        return split;
    }
    
    public FeeParams copy() {
        try {
            return (FeeParams) clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException(e); // never happens
        }
    }
}
