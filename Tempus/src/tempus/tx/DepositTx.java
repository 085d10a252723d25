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
import tempus.Timestamp;
import java.util.Date;
import org.prevayler.TransactionWithQuery;

/**
 * Owner funds an outside account with the ledger's currency.
 */
public class DepositTx implements TransactionWithQuery<DataModel, Void> {
    private static final long serialVersionUID = 1L;
    long caller;
    long account;
    long amount;
    public DepositTx(long caller, long account, long amount) {
        this.caller = caller;
        this.account = account;
        this.amount = amount;
    }
    @Override
    public Void executeAndQuery(DataModel dm, Date date) throws Exception {
        dm.deposit(caller, account, amount, Timestamp.fromDate(date));
        return null;
    }
}
