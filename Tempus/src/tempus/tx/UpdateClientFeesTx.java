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
 * The client fee recipient changes its cut and the fallback referral reward.
 */
public class UpdateClientFeesTx implements TransactionWithQuery<DataModel, Void> {
    private static final long serialVersionUID = 1L;
    long caller;
    int clientBps;
    int clientReferralBps;
    public UpdateClientFeesTx(long caller, int clientBps, int clientReferralBps) {
        this.caller = caller;
        this.clientBps = clientBps;
        this.clientReferralBps = clientReferralBps;
    }
    @Override
    public Void executeAndQuery(DataModel dm, Date date) throws Exception {
        dm.updateClientFees(caller, clientBps, clientReferralBps, Timestamp.fromDate(date));
        return null;
    }
}
