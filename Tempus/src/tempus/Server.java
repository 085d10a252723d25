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

import tempus.tx.*;

import java.nio.file.Paths;
import java.util.ArrayList;
import org.prevayler.Prevayler;
import org.prevayler.PrevaylerFactory;
import org.prevayler.Query;
import org.prevayler.TransactionWithQuery;

/**
 * An instance of a Tempus server.
 * 
 * Every call becomes one Prevayler transaction or query. Prevayler runs 
 *   transactions one at a time, so the RMI threads never see each other's 
 *   half-done work.
 */
public class Server implements ServerInterface {
    
    // The ledger.
    Prevayler<DataModel> dm;
    
    //===================================================================
    
    // Open the ledger kept under dataDir, restoring whatever is there.
    public Server(String dataDir) throws Exception {
        this(PrevaylerFactory.createPrevayler(new DataModel(), Paths.get(dataDir, "dm").toString()));
        LedgerStats stats = getStats();
        Main.log("Restored ledger: initialized=" + stats.initialized + ", subscriptions=" + stats.subCount 
                + ", events=" + stats.eventCount + ", held=" + Main.formatMoney(stats.heldBalance));
    }
    
    // Serve an already open ledger (tests use a transient one).
    public Server(Prevayler<DataModel> dm) {
        this.dm = dm;
    }
    
    //===================================================================
    // Internal (local) methods 
    //===================================================================
    
    <R> R execute(TransactionWithQuery<DataModel, R> tx) throws LedgerException {
        try {
            return dm.execute(tx);
        } catch (LedgerException e) {
            throw e;
        } catch (Exception e) {
            Main.logError(tx.getClass().getSimpleName(), e);
            throw new LedgerException(Error.EXCEPTION_NEVER_HAPPENS, e);
        }
    }
    
    <R> R execute(Query<DataModel, R> query) throws LedgerException {
        try {
            return dm.execute(query);
        } catch (LedgerException e) {
            throw e;
        } catch (Exception e) {
            Main.logError(query.getClass().getSimpleName(), e);
            throw new LedgerException(Error.EXCEPTION_NEVER_HAPPENS, e);
        }
    }
    
    public void initialize(InitParams params) throws LedgerException {
        execute(new InitializeTx(params));
    }
    
    // force a snapshot taken
    public void takeSnapshot() throws Exception {
        Main.log("Taking snapshot.");
        dm.takeSnapshot();
    }
    
    public void close() throws Exception {
        dm.close();
    }
    
    //===================================================================
    // ServerInterface
    //===================================================================
    
    @Override
    public void shutdown(long caller) throws LedgerException {
        LedgerStats stats = getStats();
        if (caller == 0 || caller != stats.owner)
            throw new LedgerException(Error.UNAUTHORIZED, "account " + caller + " is not the owner");
        Main.log("Shutdown requested by " + caller + ".");
        Main.requestServerShutdown();
    }
    
    @Override
    public void deposit(long caller, long account, long amount) throws LedgerException {
        execute(new DepositTx(caller, account, amount));
    }

    @Override
    public PurchaseResult purchase(long caller, long account, int tierId, long amount, long attachedValue, 
            long referralCode, long referrer) throws LedgerException 
    {
        PurchaseResult r = execute(new PurchaseTx(caller, account, tierId, amount, attachedValue, referralCode, referrer));
        Main.log("Purchase: account " + account + " paid " + Main.formatMoney(amount) 
                + ", token " + r.tokenId + " expires at " + r.expiresAt);
        return r;
    }

    @Override
    public long grantTime(long caller, long account, long numSeconds, int tierId) throws LedgerException {
        return execute(new GrantTimeTx(caller, account, numSeconds, tierId));
    }

    @Override
    public long revokeTime(long caller, long account) throws LedgerException {
        return execute(new RevokeTimeTx(caller, account));
    }

    @Override
    public long refund(long caller, long account, long numTokens) throws LedgerException {
        long removed = execute(new RefundTx(caller, account, numTokens));
        Main.log("Refund: " + Main.formatMoney(numTokens) + " to account " + account + ", " + removed + "s removed");
        return removed;
    }

    @Override
    public boolean deactivateSubscription(long account) throws LedgerException {
        return execute(new DeactivateSubscriptionTx(account));
    }

    @Override
    public void transferSubscription(long from, long to) throws LedgerException {
        execute(new TransferSubscriptionTx(from, to));
    }

    @Override
    public void yieldRewards(long caller, long amount, long attachedValue) throws LedgerException {
        execute(new YieldRewardsTx(caller, amount, attachedValue));
    }

    @Override
    public long claimRewards(long account) throws LedgerException {
        return execute(new ClaimRewardsTx(account));
    }

    @Override
    public long slash(long caller, long account) throws LedgerException {
        long amount = execute(new SlashTx(caller, account));
        Main.log("Slash: account " + account + " by " + caller + ", entitlement " + Main.formatMoney(amount));
        return amount;
    }

    @Override
    public void issueRewardShares(long caller, long account, long numShares) throws LedgerException {
        execute(new IssueRewardSharesTx(caller, account, numShares));
    }

    @Override
    public int createRewardCurve(long caller, CurveParams params) throws LedgerException {
        return execute(new CreateRewardCurveTx(caller, params));
    }

    @Override
    public void setRewardParams(long caller, boolean slashable, long slashGracePeriod) throws LedgerException {
        execute(new SetRewardParamsTx(caller, slashable, slashGracePeriod));
    }

    @Override
    public long withdraw(long caller) throws LedgerException {
        long amount = execute(new WithdrawTx(caller));
        Main.log("Withdrawal: " + Main.formatMoney(amount) + " by " + caller);
        return amount;
    }

    @Override
    public long withdrawTo(long caller, long to) throws LedgerException {
        long amount = execute(new WithdrawToTx(caller, to));
        Main.log("Withdrawal: " + Main.formatMoney(amount) + " by " + caller + " to " + to);
        return amount;
    }

    @Override
    public void setTransferRecipient(long caller, long account) throws LedgerException {
        execute(new SetTransferRecipientTx(caller, account));
    }

    @Override
    public int createTier(long caller, TierParams params) throws LedgerException {
        return execute(new CreateTierTx(caller, params));
    }

    @Override
    public void updateTier(long caller, int tierId, TierParams params) throws LedgerException {
        execute(new UpdateTierTx(caller, tierId, params));
    }

    @Override
    public void setTierPaused(long caller, int tierId, boolean paused) throws LedgerException {
        execute(new SetTierPausedTx(caller, tierId, paused));
    }

    @Override
    public void setGlobalSupplyCap(long caller, long cap) throws LedgerException {
        execute(new SetGlobalSupplyCapTx(caller, cap));
    }

    @Override
    public void setReferralCode(long caller, long code, int basisPoints, boolean permanent, long restrictedAccount) 
            throws LedgerException 
    {
        execute(new SetReferralCodeTx(caller, code, basisPoints, permanent, restrictedAccount));
    }

    @Override
    public void deleteReferralCode(long caller, long code) throws LedgerException {
        execute(new DeleteReferralCodeTx(caller, code));
    }

    @Override
    public void updateProtocolFeeRecipient(long caller, long recipient) throws LedgerException {
        execute(new UpdateProtocolFeeRecipientTx(caller, recipient));
    }

    @Override
    public void updateClientFeeRecipient(long caller, long recipient) throws LedgerException {
        execute(new UpdateClientFeeRecipientTx(caller, recipient));
    }

    @Override
    public void updateClientFees(long caller, int clientBps, int clientReferralBps) throws LedgerException {
        execute(new UpdateClientFeesTx(caller, clientBps, clientReferralBps));
    }

    @Override
    public void grantRoles(long caller, long account, int roleMask) throws LedgerException {
        execute(new GrantRolesTx(caller, account, roleMask));
    }

    @Override
    public void revokeRoles(long caller, long account, int roleMask) throws LedgerException {
        execute(new RevokeRolesTx(caller, account, roleMask));
    }

    @Override
    public void transferOwnership(long caller, long newOwner) throws LedgerException {
        execute(new TransferOwnershipTx(caller, newOwner));
        Main.log("Ownership transferred from " + caller + " to " + newOwner);
    }

    @Override
    public Subscription getSubscription(long account) throws LedgerException {
        return execute(new GetSubscription(account));
    }

    @Override
    public long remainingSeconds(long account) throws LedgerException {
        return execute(new GetRemainingSeconds(account));
    }

    @Override
    public Tier getTier(int tierId) throws LedgerException {
        return execute(new GetTier(tierId));
    }

    @Override
    public int getTierCount() throws LedgerException {
        return execute(new GetTierCount());
    }

    @Override
    public RewardCurve getRewardCurve(int curveId) throws LedgerException {
        return execute(new GetRewardCurve(curveId));
    }

    @Override
    public ReferralCode getReferralCode(long code) throws LedgerException {
        return execute(new GetReferralCode(code));
    }

    @Override
    public FeeParams getFeeParams() throws LedgerException {
        return execute(new GetFeeParams());
    }

    @Override
    public RewardParams getRewardParams() throws LedgerException {
        return execute(new GetRewardParams());
    }

    @Override
    public PoolDetail getPoolDetail() throws LedgerException {
        return execute(new GetPoolDetail());
    }

    @Override
    public long rewardBalanceOf(long account) throws LedgerException {
        return execute(new GetRewardBalance(account));
    }

    @Override
    public long creatorBalance() throws LedgerException {
        return execute(new GetCreatorBalance());
    }

    @Override
    public long balanceOf(long account) throws LedgerException {
        return execute(new GetBalance(account));
    }

    @Override
    public ArrayList<LedgerEvent> getEvents(long fromSeq, int max) throws LedgerException {
        return execute(new GetEvents(fromSeq, max));
    }

    @Override
    public LedgerStats getStats() throws LedgerException {
        return execute(new GetLedgerStats());
    }
}
