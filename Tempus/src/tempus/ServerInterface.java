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

import java.rmi.Remote;
import java.rmi.RemoteException;
import java.util.ArrayList;

/**
 * This is the public API of the Tempus server.
 * 
 * The calling account is passed explicitly: the front end that talks to 
 *   this server has already authenticated it. Every call either completes 
 *   or throws a LedgerException with nothing changed.
 */
public interface ServerInterface extends Remote {
    
    // ===== Admin =========================================================
    
    // Shut down the server (owner only)
    void shutdown(long caller) throws LedgerException, RemoteException;
    
    // Fund an outside account with the ledger's currency (owner only)
    void deposit(long caller, long account, long amount) throws LedgerException, RemoteException;
    
    // ===== Subscriptions ==================================================
    
    PurchaseResult purchase(long caller, long account, int tierId, long amount, long attachedValue, 
            long referralCode, long referrer) throws LedgerException, RemoteException;
    
    // Returns the new expiry
    long grantTime(long caller, long account, long numSeconds, int tierId) throws LedgerException, RemoteException;
    
    // Returns the seconds removed
    long revokeTime(long caller, long account) throws LedgerException, RemoteException;
    
    // Returns the seconds removed
    long refund(long caller, long account, long numTokens) throws LedgerException, RemoteException;
    
    boolean deactivateSubscription(long account) throws LedgerException, RemoteException;
    
    void transferSubscription(long from, long to) throws LedgerException, RemoteException;
    
    // ===== Rewards ========================================================
    
    void yieldRewards(long caller, long amount, long attachedValue) throws LedgerException, RemoteException;
    
    long claimRewards(long account) throws LedgerException, RemoteException;
    
    long slash(long caller, long account) throws LedgerException, RemoteException;
    
    void issueRewardShares(long caller, long account, long numShares) throws LedgerException, RemoteException;
    
    int createRewardCurve(long caller, CurveParams params) throws LedgerException, RemoteException;
    
    void setRewardParams(long caller, boolean slashable, long slashGracePeriod) throws LedgerException, RemoteException;
    
    // ===== Creator funds ==================================================
    
    long withdraw(long caller) throws LedgerException, RemoteException;
    
    long withdrawTo(long caller, long to) throws LedgerException, RemoteException;
    
    void setTransferRecipient(long caller, long account) throws LedgerException, RemoteException;
    
    // ===== Configuration ==================================================
    
    int createTier(long caller, TierParams params) throws LedgerException, RemoteException;
    
    void updateTier(long caller, int tierId, TierParams params) throws LedgerException, RemoteException;
    
    void setTierPaused(long caller, int tierId, boolean paused) throws LedgerException, RemoteException;
    
    void setGlobalSupplyCap(long caller, long cap) throws LedgerException, RemoteException;
    
    void setReferralCode(long caller, long code, int basisPoints, boolean permanent, long restrictedAccount) 
            throws LedgerException, RemoteException;
    
    void deleteReferralCode(long caller, long code) throws LedgerException, RemoteException;
    
    void updateProtocolFeeRecipient(long caller, long recipient) throws LedgerException, RemoteException;
    
    void updateClientFeeRecipient(long caller, long recipient) throws LedgerException, RemoteException;
    
    void updateClientFees(long caller, int clientBps, int clientReferralBps) throws LedgerException, RemoteException;
    
    void grantRoles(long caller, long account, int roleMask) throws LedgerException, RemoteException;
    
    void revokeRoles(long caller, long account, int roleMask) throws LedgerException, RemoteException;
    
    void transferOwnership(long caller, long newOwner) throws LedgerException, RemoteException;
    
    // ===== Reads ==========================================================
    
    // null if the account never had a subscription
    Subscription getSubscription(long account) throws LedgerException, RemoteException;
    
    long remainingSeconds(long account) throws LedgerException, RemoteException;
    
    Tier getTier(int tierId) throws LedgerException, RemoteException;
    
    int getTierCount() throws LedgerException, RemoteException;
    
    RewardCurve getRewardCurve(int curveId) throws LedgerException, RemoteException;
    
    // null if there is no such code
    ReferralCode getReferralCode(long code) throws LedgerException, RemoteException;
    
    FeeParams getFeeParams() throws LedgerException, RemoteException;
    
    RewardParams getRewardParams() throws LedgerException, RemoteException;
    
    PoolDetail getPoolDetail() throws LedgerException, RemoteException;
    
    long rewardBalanceOf(long account) throws LedgerException, RemoteException;
    
    long creatorBalance() throws LedgerException, RemoteException;
    
    long balanceOf(long account) throws LedgerException, RemoteException;
    
    ArrayList<LedgerEvent> getEvents(long fromSeq, int max) throws LedgerException, RemoteException;
    
    LedgerStats getStats() throws LedgerException, RemoteException;
}
