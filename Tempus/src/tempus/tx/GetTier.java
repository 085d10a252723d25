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
import tempus.Tier;
import java.util.Date;
import org.prevayler.Query;

public class GetTier implements Query<DataModel, Tier> {
    private static final long serialVersionUID = 1L;
    int tierId;
    public GetTier(int tierId) {
        this.tierId = tierId;
    }
    @Override
    public Tier query(DataModel dm, Date date) throws Exception {
        return dm.getTier(tierId);
    }
}
