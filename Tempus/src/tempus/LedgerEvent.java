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
 * An entry into the ledger's event log. These are the durable record 
 *   observers and indexers follow.
 */
public class LedgerEvent implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public LedgerEvent(long seq, long timestamp, short code, long account, long amount, long otherAccount, long id) {
        this.seq = seq;
        this.timestamp = timestamp;
        this.code = code;
        this.account = account;
        this.amount = amount;
        this.otherAccount = otherAccount;
        this.id = id;
    }
    
    public long getSeq() { return seq; }
    public long getTimestamp() { return timestamp; }
    public short getCode() { return code; }
    public long getAccount() { return account; }
    public long getAmount() { return amount; }
    public long getOtherAccount() { return otherAccount; }
    public long getId() { return id; }
    
    // Position in the log, from 0.
    final long seq;
    
    // When this happened, in seconds since epoch (class Timestamp)
    final long timestamp;
    
    // What happened
    final short code;
    
    // Main account involved (0 if none)
    final long account;
    
    // Amount moved, or seconds for time events (0 if none)
    final long amount;
    
    // Another account involved: payer, referrer, destination (0 if none)
    final long otherAccount;
    
    // Tier, curve, token or referral code id (0 if none)
    final long id;
    
    @Override
    public String toString() {
        return "#" + seq + " @" + timestamp + " code=" + code + " account=" + account 
                + " amount=" + amount + " other=" + otherAccount + " id=" + id;
    }
    
    // ---------------------------------------------------------
    //  Subscription events
    // ---------------------------------------------------------
    
    // Purchase completed. account = subscriber, amount = paid, 
    //   otherAccount = payer, id = token id.
    public static final short PURCHASE                          = 1;
    
    // Time granted without payment. amount = seconds, id = tier id.
    public static final short GRANT                             = 2;
    
    // Granted time revoked. amount = seconds removed.
    public static final short REVOKE                            = 3;
    
    // Paid time refunded. amount = tokens returned.
    public static final short REFUND                            = 4;
    
    // Lapsed subscription dropped its tier. id = former tier id.
    public static final short DEACTIVATE                        = 5;
    
    // Subscription moved. account = from, otherAccount = to, id = token id.
    public static final short TRANSFER                          = 6;
    
    // ---------------------------------------------------------
    //  Money events
    // ---------------------------------------------------------
    
    // Protocol or client fee paid. account = recipient, id = FEE_LEG_*.
    public static final short FEE_TRANSFER                      = 32;
    
    // Referral reward paid. account = referrer, id = referral code.
    public static final short REFERRAL_PAYOUT                   = 33;
    
    // Creator balance withdrawn. account = destination.
    public static final short WITHDRAWAL                        = 34;
    
    // Outside funds deposited into an account.
    public static final short DEPOSIT                           = 35;
    
    // ---------------------------------------------------------
    //  Reward pool events
    // ---------------------------------------------------------
    
    // Yield added to the pool. otherAccount = payer (0 for purchases).
    public static final short REWARDS_ALLOCATED                 = 64;
    
    public static final short REWARDS_CLAIMED                   = 65;
    
    // amount = shares, id = curve id (-1 for direct issuance).
    public static final short SHARES_ISSUED                     = 66;
    
    // Holder slashed and paid. amount = payout.
    public static final short SLASHED                           = 67;
    
    // Holder slashed, payout rejected and left in the pool.
    public static final short SLASH_TRANSFER_FALLBACK           = 68;
    
    // ---------------------------------------------------------
    //  Configuration events
    // ---------------------------------------------------------
    
    public static final short TIER_CREATED                      = 96;
    public static final short TIER_UPDATED                      = 97;
    public static final short TIER_PAUSED                       = 98;
    public static final short TIER_UNPAUSED                     = 99;
    public static final short CURVE_CREATED                     = 100;
    public static final short REFERRAL_SET                      = 101;
    public static final short REFERRAL_DELETED                  = 102;
    public static final short GLOBAL_SUPPLY_CAP_CHANGED         = 103;
    
    // account = new recipient, id = FEE_LEG_*.
    public static final short FEE_RECIPIENT_CHANGED             = 104;
    public static final short FEE_BPS_CHANGED                   = 105;
    public static final short REWARD_PARAMS_CHANGED             = 106;
    public static final short ROLES_CHANGED                     = 107;
    public static final short TRANSFER_RECIPIENT_CHANGED        = 108;
    public static final short INITIALIZED                       = 109;
    
    // Fee legs, in the id field of fee events.
    public static final long FEE_LEG_PROTOCOL                   = 1;
    public static final long FEE_LEG_CLIENT                     = 2;
}
