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
import java.util.ArrayList;

/**
 * The core data model of the ledger: tiers, subscriptions, the reward 
 *   pool, fees, referrals and the holdings of the outside world.
 * 
 * This is a Prevayler prevalent system. Every method that changes it is 
 *   called from a transaction in tempus.tx, with the transaction's 
 *   timestamp as `now`; it must not look at the wall clock or anything 
 *   else outside the model, or the journal won't replay.
 * 
 * Every operation first checks everything that could make it fail and 
 *   only then changes state, so a LedgerException always means "nothing 
 *   happened". Fungible capture is the one step that must move funds to 
 *   know whether it worked, and it undoes itself before throwing.
 * 
 * Conservation: currency held by the ledger == creatorBalance() + 
 *   pool balance, at every point between operations.
 */
public class DataModel implements Serializable {
    private static final long serialVersionUID = 1L;
    
    boolean initialized;
    
    Currency currency;
    
    AccessControl access;
    
    // The outside world's holdings and the ledger's own.
    AssetBook assets = new AssetBook();
    
    TierRegistry tiers = new TierRegistry();
    
    SubscriptionLedger ledger = new SubscriptionLedger();
    
    ReferralRegistry referrals = new ReferralRegistry();
    
    FeeParams fees = new FeeParams();
    
    RewardPool pool = new RewardPool();
    
    RewardParams rewardParams = new RewardParams();
    
    // Default destination of creator withdrawals. Owner if 0.
    long transferRecipient;
    
    // The event log. Append-only.
    ArrayList<LedgerEvent> events = new ArrayList<>();
    
    // Set while purchase() or yieldRewards() runs. A payment callback 
    //   re-entering either of them finds it set and is refused.
    transient boolean busy;
    
    //==================================================================
    
    void emit(long now, short code, long account, long amount, long otherAccount, long id) {
        events.add(new LedgerEvent(events.size(), now, code, account, amount, otherAccount, id));
    }
    
    void checkInitialized() throws LedgerException {
        if (! initialized)
            throw new LedgerException(Error.NOT_INITIALIZED);
    }
    
    void checkRole(long caller, int roles) throws LedgerException {
        checkInitialized();
        if (! access.isAuthorized(caller, roles))
            throw new LedgerException(Error.UNAUTHORIZED, "account " + caller + " lacks role " + roles);
    }
    
    void checkOwner(long caller) throws LedgerException {
        checkInitialized();
        if (caller == 0 || caller != access.getOwner())
            throw new LedgerException(Error.UNAUTHORIZED, "account " + caller + " is not the owner");
    }
    
    static void checkAccount(long account) throws LedgerException {
        if (account <= 0)
            throw new LedgerException(Error.INVALID_ACCOUNT, "account " + account);
    }
    
    void enter() throws LedgerException {
        if (busy)
            throw new LedgerException(Error.REENTRANT_CALL);
        busy = true;
    }
    
    void exit() {
        busy = false;
    }
    
    // Resolves "tier 0" to the account's current tier, or tier 1.
    static int targetTier(Subscription sub, int tierId) {
        if (tierId != 0)
            return tierId;
        return (sub.tierId != 0) ? sub.tierId : 1;
    }
    
    //==================================================================
    // Initialization
    //==================================================================
    
    public void initialize(InitParams params, long now) throws LedgerException {
        if (initialized)
            throw new LedgerException(Error.ALREADY_INITIALIZED);
        if (params.owner <= 0)
            throw new LedgerException(Error.INVALID_INIT_PARAMS, "an owner is required");
        if (params.currency == null)
            throw new LedgerException(Error.INVALID_INIT_PARAMS, "a currency is required");
        if (params.tier == null || params.curve == null || params.fees == null || params.rewards == null)
            throw new LedgerException(Error.INVALID_INIT_PARAMS, "missing parameters");
        if (params.rewards.slashGracePeriod < 0 || params.globalSupplyCap < 0)
            throw new LedgerException(Error.INVALID_INIT_PARAMS, "negative value");
        FeeParams f = params.fees.copy();
        f.normalize();
        f.validate();
        new RewardCurve(0, params.curve, now);
        TierRegistry.validate(params.tier, 1);
        
        // ---- we're clear of all possible errors. it's happening. ----
        
        currency = params.currency;
        access = (params.accessControl != null) ? params.accessControl : new RoleTable(params.owner);
        fees = f;
        rewardParams = params.rewards.copy();
        ledger.supplyCap = params.globalSupplyCap;
        pool.createCurve(params.curve, now);
        tiers.createTier(params.tier, pool.getNumCurves());
        initialized = true;
        
        emit(now, LedgerEvent.INITIALIZED, params.owner, 0, 0, 0);
        emit(now, LedgerEvent.CURVE_CREATED, params.owner, 0, 0, 0);
        emit(now, LedgerEvent.TIER_CREATED, params.owner, 0, 0, 1);
    }
    
    //==================================================================
    // Purchases
    //==================================================================
    
    // `caller` pays `amount` (with `attachedValue` of native asset 
    //   attached to the call) for time on `tierId` for `account`.
    public PurchaseResult purchase(long caller, long account, int tierId, long amount, 
            long attachedValue, long referralCode, long referrer, long now) throws LedgerException 
    {
        checkInitialized();
        enter();
        try {
            return doPurchase(caller, account, tierId, amount, attachedValue, referralCode, referrer, now);
        } finally {
            exit();
        }
    }
    
    private PurchaseResult doPurchase(long caller, long account, int tierId, long amount, 
            long attachedValue, long referralCode, long referrer, long now) throws LedgerException 
    {
        checkAccount(account);
        checkAccount(caller);
        if (referrer < 0)
            throw new LedgerException(Error.INVALID_ACCOUNT, "referrer " + referrer);
        if (amount < 0)
            throw new LedgerException(Error.INVALID_AMOUNT);
        
        Subscription sub = ledger.copyOf(account);
        Tier tier = tiers.getTier(targetTier(sub, tierId));
        if (tier.params.paused)
            throw new LedgerException(Error.TIER_PAUSED, "tier " + tier.id);
        if (now < tier.params.startTimestamp)
            throw new LedgerException(Error.TIER_NOT_STARTED, "tier " + tier.id);
        
        // Only the account itself may move to another tier.
        Tier oldTier = tiers.findTier(sub.tierId);
        boolean switching = (oldTier != null) && (oldTier.id != tier.id);
        if (switching && caller != account)
            throw new LedgerException(Error.TIER_INVALID_SWITCH, 
                    "account " + caller + " cannot move " + account + " from tier " + oldTier.id + " to " + tier.id);
        boolean joining = (sub.tierId != tier.id);
        if (joining)
            tiers.checkJoin(tier);
        boolean minting = (sub.tokenId == 0);
        if (minting)
            ledger.checkMint();
        
        long seconds = SubscriptionLedger.tokensToSeconds(tier, sub, amount);
        SubscriptionLedger.convertTier(sub, oldTier, tier, now);
        SubscriptionLedger.extendPaid(sub, seconds, now);
        SubscriptionLedger.checkCommitment(sub, tier, now);
        
        int referralBps = referrals.resolveBps(referralCode, referrer, fees);
        FeeSplit split = fees.split(amount, referralBps);
        if (split.protocolFee > 0)
            currency.checkTransfer(assets, fees.protocolRecipient);
        if (split.clientFee > 0)
            currency.checkTransfer(assets, fees.clientRecipient);
        if (split.referralFee > 0)
            currency.checkTransfer(assets, referrer);
        
        long rewards = Bps.of(split.net, tier.params.rewardBasisPoints);
        Bps.add(pool.getTotalAllocated(), rewards);
        long shares = pool.previewShares(tier.params.rewardCurveId, split.net, now);
        pool.checkIssue(shares);
        
        // The last check: moves the funds in, or fails having moved nothing.
        currency.capture(assets, caller, amount, attachedValue);
        
        // ---- we're clear of all possible errors. it's happening. ----
        
        if (minting)
            sub.tokenId = ledger.mint();
        if (joining) {
            if (oldTier != null)
                tiers.leave(oldTier);
            tiers.join(tier);
        }
        ledger.store(account, sub);
        
        if (split.protocolFee > 0) {
            currency.transfer(assets, fees.protocolRecipient, split.protocolFee);
            emit(now, LedgerEvent.FEE_TRANSFER, fees.protocolRecipient, split.protocolFee, account, LedgerEvent.FEE_LEG_PROTOCOL);
        }
        if (split.clientFee > 0) {
            currency.transfer(assets, fees.clientRecipient, split.clientFee);
            emit(now, LedgerEvent.FEE_TRANSFER, fees.clientRecipient, split.clientFee, account, LedgerEvent.FEE_LEG_CLIENT);
        }
        if (split.referralFee > 0) {
            currency.transfer(assets, referrer, split.referralFee);
            emit(now, LedgerEvent.REFERRAL_PAYOUT, referrer, split.referralFee, account, referralCode);
        }
        
        // Existing holders are rewarded before the buyer's shares exist.
        if (pool.allocate(rewards))
            emit(now, LedgerEvent.REWARDS_ALLOCATED, account, rewards, 0, tier.id);
        if (shares > 0) {
            pool.issue(account, shares);
            emit(now, LedgerEvent.SHARES_ISSUED, account, shares, 0, tier.params.rewardCurveId);
        }
        
        emit(now, LedgerEvent.PURCHASE, account, amount, caller, sub.tokenId);
        return new PurchaseResult(sub.tokenId, split.net, shares, sub.expiresAt);
    }
    
    //==================================================================
    // Privileged time management
    //==================================================================
    
    // Returns the new expiry.
    public long grantTime(long caller, long account, long numSeconds, int tierId, long now) 
            throws LedgerException 
    {
        checkRole(caller, AccessControl.ROLE_AGENT);
        checkAccount(account);
        if (numSeconds <= 0)
            throw new LedgerException(Error.INVALID_AMOUNT);
        
        Subscription sub = ledger.copyOf(account);
        Tier tier = tiers.getTier(targetTier(sub, tierId));
        Tier oldTier = tiers.findTier(sub.tierId);
        boolean joining = (sub.tierId != tier.id);
        if (joining)
            tiers.checkJoin(tier);
        boolean minting = (sub.tokenId == 0);
        if (minting)
            ledger.checkMint();
        SubscriptionLedger.convertTier(sub, oldTier, tier, now);
        SubscriptionLedger.extendGranted(sub, numSeconds, now);
        
        // ---- we're clear of all possible errors. it's happening. ----
        
        if (minting)
            sub.tokenId = ledger.mint();
        if (joining) {
            if (oldTier != null)
                tiers.leave(oldTier);
            tiers.join(tier);
        }
        ledger.store(account, sub);
        emit(now, LedgerEvent.GRANT, account, numSeconds, caller, tier.id);
        return sub.expiresAt;
    }
    
    // Takes back granted time, never paid time. Returns seconds removed.
    public long revokeTime(long caller, long account, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_AGENT);
        checkAccount(account);
        Subscription stored = ledger.find(account);
        if (stored == null)
            throw new LedgerException(Error.NO_SUBSCRIPTION, "account " + account);
        Subscription sub = stored.copy();
        long removed = SubscriptionLedger.revokeGranted(sub, now);
        ledger.store(account, sub);
        emit(now, LedgerEvent.REVOKE, account, removed, caller, sub.tierId);
        return removed;
    }
    
    // Returns numTokens from the creator balance to the account and takes 
    //   back the paid time they were worth. Returns seconds removed.
    public long refund(long caller, long account, long numTokens, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_AGENT);
        checkAccount(account);
        if (numTokens < 0)
            throw new LedgerException(Error.INVALID_AMOUNT);
        Subscription stored = ledger.find(account);
        if (stored == null)
            throw new LedgerException(Error.NO_SUBSCRIPTION, "account " + account);
        long available = creatorBalance();
        if (available < numTokens)
            throw new LedgerException(Error.INSUFFICIENT_BALANCE, 
                    "creator balance " + available + " < refund " + numTokens);
        if (numTokens > 0)
            currency.checkTransfer(assets, account);
        Subscription sub = stored.copy();
        long removed = SubscriptionLedger.refundPaid(sub, tiers.findTier(sub.tierId), numTokens, now);
        
        // ---- we're clear of all possible errors. it's happening. ----
        
        ledger.store(account, sub);
        if (numTokens > 0)
            currency.transfer(assets, account, numTokens);
        emit(now, LedgerEvent.REFUND, account, numTokens, caller, removed);
        return removed;
    }
    
    // Drops the tier of a lapsed subscription, keeping its token and 
    //   shares. Anyone may call it. Returns false if there was nothing 
    //   to do (no tier, or not lapsed yet).
    public boolean deactivateSubscription(long account, long now) throws LedgerException {
        checkInitialized();
        Subscription sub = ledger.find(account);
        if (sub == null || sub.tierId == 0 || now <= sub.expiresAt)
            return false;
        Tier tier = tiers.findTier(sub.tierId);
        if (tier != null)
            tiers.leave(tier);
        int formerTier = sub.tierId;
        sub.tierId = 0;
        emit(now, LedgerEvent.DEACTIVATE, account, 0, 0, formerTier);
        return true;
    }
    
    // Hook called by the identity layer before it completes a transfer 
    //   of the subscription token from one account to another.
    public void transferSubscription(long from, long to, long now) throws LedgerException {
        checkInitialized();
        checkAccount(from);
        checkAccount(to);
        if (from == to)
            throw new LedgerException(Error.NOTHING_TO_DO);
        Subscription sub = ledger.find(from);
        if (sub == null || sub.tokenId == 0)
            throw new LedgerException(Error.NO_SUBSCRIPTION, "account " + from);
        Subscription dest = ledger.find(to);
        if (dest != null && dest.tokenId != 0)
            throw new LedgerException(Error.DESTINATION_HAS_SUBSCRIPTION, "account " + to);
        Tier tier = tiers.findTier(sub.tierId);
        if (tier != null && ! tier.params.transferable)
            throw new LedgerException(Error.TRANSFER_NOT_ALLOWED, "tier " + tier.id);
        
        ledger.remove(from);
        ledger.store(to, sub);
        pool.moveHolder(from, to);
        emit(now, LedgerEvent.TRANSFER, from, 0, to, sub.tokenId);
    }
    
    //==================================================================
    // Reward pool
    //==================================================================
    
    // Anyone may top up the pool; the value goes to current holders.
    public void yieldRewards(long caller, long amount, long attachedValue, long now) throws LedgerException {
        checkInitialized();
        enter();
        try {
            checkAccount(caller);
            if (amount <= 0)
                throw new LedgerException(Error.INVALID_AMOUNT);
            if (pool.getTotalShares() == 0)
                throw new LedgerException(Error.POOL_EMPTY);
            Bps.add(pool.getTotalAllocated(), amount);
            currency.capture(assets, caller, amount, attachedValue);
            pool.allocate(amount);
            emit(now, LedgerEvent.REWARDS_ALLOCATED, 0, amount, caller, 0);
        } finally {
            exit();
        }
    }
    
    // Pays an account its whole entitlement. Anyone may trigger it for 
    //   any account. Returns the amount paid (0 is a no-op).
    public long claimRewards(long account, long now) throws LedgerException {
        checkInitialized();
        checkAccount(account);
        long amount = pool.rewardBalanceOf(account);
        if (amount == 0)
            return 0;
        currency.checkTransfer(assets, account);
        pool.claim(account);
        currency.transfer(assets, account, amount);
        emit(now, LedgerEvent.REWARDS_CLAIMED, account, amount, 0, 0);
        return amount;
    }
    
    // Removes a lapsed holder's shares and pays out its entitlement. If 
    //   the payout is rejected the value stays in the pool for the other 
    //   holders and the slash still happens. Returns the entitlement.
    public long slash(long caller, long account, long now) throws LedgerException {
        checkInitialized();
        checkAccount(account);
        if (! rewardParams.slashable)
            throw new LedgerException(Error.NOT_SLASHABLE, "slashing is disabled");
        Subscription sub = ledger.find(account);
        long expiresAt = (sub == null) ? 0 : sub.expiresAt;
        if (now - expiresAt <= rewardParams.slashGracePeriod)
            throw new LedgerException(Error.NOT_SLASHABLE, 
                    "account " + account + " expires at " + expiresAt + ", grace " + rewardParams.slashGracePeriod);
        if (pool.sharesOf(account) == 0)
            throw new LedgerException(Error.NOTHING_TO_DO, "account " + account + " holds no shares");
        
        long amount = pool.burn(account);
        if (currency.tryTransfer(assets, account, amount)) {
            pool.paidOut(amount);
            emit(now, LedgerEvent.SLASHED, account, amount, caller, 0);
        } else {
            pool.redistribute(amount);
            emit(now, LedgerEvent.SLASH_TRANSFER_FALLBACK, account, amount, caller, 0);
        }
        return amount;
    }
    
    // Shares without payment, for the issuer role.
    public void issueRewardShares(long caller, long account, long numShares, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_ISSUER);
        checkAccount(account);
        if (numShares <= 0)
            throw new LedgerException(Error.INVALID_AMOUNT);
        pool.checkIssue(numShares);
        pool.issue(account, numShares);
        emit(now, LedgerEvent.SHARES_ISSUED, account, numShares, caller, -1);
    }
    
    public int createRewardCurve(long caller, CurveParams params, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        if (params == null)
            throw new LedgerException(Error.INVALID_CURVE_PARAMS);
        int id = pool.createCurve(params, now);
        emit(now, LedgerEvent.CURVE_CREATED, caller, 0, 0, id);
        return id;
    }
    
    public void setRewardParams(long caller, boolean slashable, long slashGracePeriod, long now) 
            throws LedgerException 
    {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        if (slashable && ! rewardParams.slashable)
            throw new LedgerException(Error.INVALID_REWARD_PARAMS, "slashing cannot be re-enabled");
        if (slashGracePeriod < 0)
            throw new LedgerException(Error.INVALID_REWARD_PARAMS, "negative grace period");
        rewardParams = new RewardParams(slashable, slashGracePeriod);
        emit(now, LedgerEvent.REWARD_PARAMS_CHANGED, caller, slashGracePeriod, 0, slashable ? 1 : 0);
    }
    
    //==================================================================
    // Creator funds
    //==================================================================
    
    public long withdraw(long caller, long now) throws LedgerException {
        checkInitialized();
        long to = (transferRecipient != 0) ? transferRecipient : access.getOwner();
        return withdrawTo(caller, to, now);
    }
    
    // Moves the whole creator balance out. Returns the amount.
    public long withdrawTo(long caller, long to, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        checkAccount(to);
        long amount = creatorBalance();
        if (amount == 0)
            throw new LedgerException(Error.NOTHING_TO_DO, "creator balance is empty");
        currency.checkTransfer(assets, to);
        currency.transfer(assets, to, amount);
        emit(now, LedgerEvent.WITHDRAWAL, to, amount, caller, 0);
        return amount;
    }
    
    public void setTransferRecipient(long caller, long account, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        if (account < 0)
            throw new LedgerException(Error.INVALID_ACCOUNT);
        transferRecipient = account;
        emit(now, LedgerEvent.TRANSFER_RECIPIENT_CHANGED, account, 0, caller, 0);
    }
    
    // Funds an outside account with the ledger's currency (bridge-in).
    public void deposit(long caller, long account, long amount, long now) throws LedgerException {
        checkOwner(caller);
        assets.deposit(currency.getAssetKey(), account, amount);
        emit(now, LedgerEvent.DEPOSIT, account, amount, caller, 0);
    }
    
    //==================================================================
    // Tiers and supply
    //==================================================================
    
    public int createTier(long caller, TierParams params, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        if (params == null)
            throw new LedgerException(Error.INVALID_TIER_PARAMS);
        int id = tiers.createTier(params, pool.getNumCurves());
        emit(now, LedgerEvent.TIER_CREATED, caller, 0, 0, id);
        return id;
    }
    
    public void updateTier(long caller, int tierId, TierParams params, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        if (params == null)
            throw new LedgerException(Error.INVALID_TIER_PARAMS);
        tiers.updateTier(tierId, params, pool.getNumCurves());
        emit(now, LedgerEvent.TIER_UPDATED, caller, 0, 0, tierId);
    }
    
    public void setTierPaused(long caller, int tierId, boolean paused, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        if (tiers.setPaused(tierId, paused))
            emit(now, paused ? LedgerEvent.TIER_PAUSED : LedgerEvent.TIER_UNPAUSED, caller, 0, 0, tierId);
    }
    
    public void setGlobalSupplyCap(long caller, long cap, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        ledger.setSupplyCap(cap);
        emit(now, LedgerEvent.GLOBAL_SUPPLY_CAP_CHANGED, caller, cap, 0, 0);
    }
    
    //==================================================================
    // Fees and referrals
    //==================================================================
    
    public void setReferralCode(long caller, long code, int bps, boolean permanent, 
            long restrictedAccount, long now) throws LedgerException 
    {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        referrals.setCode(code, bps, permanent, restrictedAccount, fees.clientBps);
        emit(now, LedgerEvent.REFERRAL_SET, restrictedAccount, bps, caller, code);
    }
    
    public void deleteReferralCode(long caller, long code, long now) throws LedgerException {
        checkRole(caller, AccessControl.ROLE_MANAGER);
        referrals.deleteCode(code);
        emit(now, LedgerEvent.REFERRAL_DELETED, 0, 0, caller, code);
    }
    
    // Only the current protocol recipient may hand its fee on.
    public void updateProtocolFeeRecipient(long caller, long recipient, long now) throws LedgerException {
        checkInitialized();
        if (caller == 0 || caller != fees.protocolRecipient)
            throw new LedgerException(Error.NOT_FEE_RECIPIENT, "account " + caller);
        FeeParams f = fees.copy();
        f.protocolRecipient = recipient;
        f.normalize();
        f.validate();
        fees = f;
        emit(now, LedgerEvent.FEE_RECIPIENT_CHANGED, recipient, 0, caller, LedgerEvent.FEE_LEG_PROTOCOL);
    }
    
    // Only the current client recipient may hand its fee on.
    public void updateClientFeeRecipient(long caller, long recipient, long now) throws LedgerException {
        checkInitialized();
        if (caller == 0 || caller != fees.clientRecipient)
            throw new LedgerException(Error.NOT_FEE_RECIPIENT, "account " + caller);
        FeeParams f = fees.copy();
        f.clientRecipient = recipient;
        f.normalize();
        f.validate();
        fees = f;
        emit(now, LedgerEvent.FEE_RECIPIENT_CHANGED, recipient, 0, caller, LedgerEvent.FEE_LEG_CLIENT);
    }
    
    // The client sets its own cut and the fallback referral reward.
    public void updateClientFees(long caller, int clientBps, int clientReferralBps, long now) throws LedgerException {
        checkInitialized();
        if (caller == 0 || caller != fees.clientRecipient)
            throw new LedgerException(Error.NOT_FEE_RECIPIENT, "account " + caller);
        FeeParams f = fees.copy();
        f.clientBps = clientBps;
        f.clientReferralBps = clientReferralBps;
        f.validate();
        f.normalize();
        fees = f;
        emit(now, LedgerEvent.FEE_BPS_CHANGED, caller, clientBps, 0, LedgerEvent.FEE_LEG_CLIENT);
    }
    
    //==================================================================
    // Roles
    //==================================================================
    
    public void grantRoles(long caller, long account, int roleMask, long now) throws LedgerException {
        roleTable(caller).grantRoles(checkRoleTarget(account), roleMask);
        emit(now, LedgerEvent.ROLES_CHANGED, account, roleMask, caller, 1);
    }
    
    public void revokeRoles(long caller, long account, int roleMask, long now) throws LedgerException {
        roleTable(caller).revokeRoles(checkRoleTarget(account), roleMask);
        emit(now, LedgerEvent.ROLES_CHANGED, account, roleMask, caller, 0);
    }
    
    public void transferOwnership(long caller, long newOwner, long now) throws LedgerException {
        roleTable(caller).transferOwnership(checkRoleTarget(newOwner));
        emit(now, LedgerEvent.ROLES_CHANGED, newOwner, -1, caller, 2);
    }

    private RoleTable roleTable(long caller) throws LedgerException {
        checkOwner(caller);
        if (!(access instanceof RoleTable))
            throw new LedgerException(Error.UNAUTHORIZED, "roles are managed outside the ledger");
        return (RoleTable) access;
    }
    
    private static long checkRoleTarget(long account) throws LedgerException {
        checkAccount(account);
        return account;
    }
    
    //==================================================================
    // Reads
    //==================================================================
    
    public boolean isInitialized() {
        return initialized;
    }
    
    public Currency getCurrency() {
        return currency;
    }
    
    // Live book, for the simulation knobs (rejecting accounts, transfer fees).
    AssetBook getAssetBook() {
        return assets;
    }
    
    public Subscription getSubscription(long account) {
        Subscription sub = ledger.find(account);
        return (sub == null) ? null : sub.copy();
    }
    
    public long remainingSeconds(long account, long now) {
        Subscription sub = ledger.find(account);
        return (sub == null) ? 0 : sub.remainingSeconds(now);
    }
    
    public Tier getTier(int tierId) throws LedgerException {
        return tiers.getTier(tierId).copy();
    }
    
    public int getTierCount() {
        return tiers.getTierCount();
    }
    
    public RewardCurve getCurve(int curveId) throws LedgerException {
        return pool.getCurve(curveId);
    }
    
    public ReferralCode getReferralCode(long code) {
        return referrals.getCode(code);
    }
    
    public FeeParams getFeeParams() {
        return fees.copy();
    }
    
    public RewardParams getRewardParams() {
        return rewardParams.copy();
    }
    
    public long rewardBalanceOf(long account) {
        return pool.rewardBalanceOf(account);
    }
    
    public Holder getHolder(long account) {
        return pool.getHolder(account);
    }
    
    // Currency held by the ledger.
    public long contractBalance() {
        return (currency == null) ? 0 : currency.balance(assets);
    }
    
    // What the creator may withdraw: everything not owed to the pool.
    public long creatorBalance() {
        return contractBalance() - pool.balance();
    }
    
    // An outside account's holdings of the ledger's currency.
    public long balanceOf(long account) {
        return (currency == null) ? 0 : assets.balanceOf(currency.getAssetKey(), account);
    }
    
    public PoolDetail getPoolDetail() {
        PoolDetail d = new PoolDetail();
        d.totalShares = pool.getTotalShares();
        d.poolBalance = pool.balance();
        d.totalAllocated = pool.getTotalAllocated();
        d.totalWithdrawn = pool.getTotalWithdrawn();
        d.numCurves = pool.getNumCurves();
        d.slashable = rewardParams.slashable;
        d.slashGracePeriod = rewardParams.slashGracePeriod;
        return d;
    }
    
    public ArrayList<LedgerEvent> getEvents(long fromSeq, int max) {
        ArrayList<LedgerEvent> out = new ArrayList<>();
        for (long i = Math.max(0, fromSeq); i < events.size() && out.size() < max; ++i)
            out.add(events.get((int) i));
        return out;
    }
    
    public long getEventCount() {
        return events.size();
    }
    
    public LedgerStats getStats() {
        LedgerStats stats = new LedgerStats();
        stats.initialized = initialized;
        stats.asset = (currency == null) ? null : currency.getAssetKey();
        stats.owner = (access == null) ? 0 : access.getOwner();
        stats.tierCount = tiers.getTierCount();
        stats.subCount = ledger.getSubCount();
        stats.globalSupplyCap = ledger.getSupplyCap();
        stats.tokenIdCounter = ledger.getTokenIdCounter();
        stats.heldBalance = contractBalance();
        stats.poolBalance = pool.balance();
        stats.creatorBalance = creatorBalance();
        stats.eventCount = events.size();
        Runtime runtime = Runtime.getRuntime();
        stats.usedMemoryBytes = runtime.totalMemory() - runtime.freeMemory();
        return stats;
    }
}
