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
package tempus.tx;

import tempus.DataModel;
import tempus.PurchaseResult;
import tempus.Timestamp;
import java.util.Date;
import org.prevayler.TransactionWithQuery;

/**
 * Someone pays for subscription time on a tier for an account.
 */
public class PurchaseTx implements TransactionWithQuery<DataModel, PurchaseResult> {
    private static final long serialVersionUID = 1L;
    long caller;
    long account;
    int tierId;
    long amount;
    long attachedValue;
    long referralCode;
    long referrer;
    public PurchaseTx(long caller, long account, int tierId, long amount, long attachedValue, long referralCode, long referrer) {
        this.caller = caller;
        this.account = account;
        this.tierId = tierId;
        this.amount = amount;
        this.attachedValue = attachedValue;
        this.referralCode = referralCode;
        this.referrer = referrer;
    }
    @Override
    public PurchaseResult executeAndQuery(DataModel dm, Date date) throws Exception {
        return dm.purchase(caller, account, tierId, amount, attachedValue, referralCode, referrer, Timestamp.fromDate(date));
    }
}
