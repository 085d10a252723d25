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
import java.util.Date;
import org.prevayler.Query;

/**
 * What an account could claim from the reward pool right now.
 */
public class GetRewardBalance implements Query<DataModel, Long> {
    private static final long serialVersionUID = 1L;
    long account;
    public GetRewardBalance(long account) {
        this.account = account;
    }
    @Override
    public Long query(DataModel dm, Date date) throws Exception {
        return dm.rewardBalanceOf(account);
    }
}
