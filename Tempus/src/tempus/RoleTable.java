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

import java.util.HashMap;

/**
 * Owner plus per-account role bitmaps. The owner holds every role.
 */
public class RoleTable implements AccessControl {
    private static final long serialVersionUID = 1L;
    
    long owner;
    
    HashMap<Long, Integer> roles = new HashMap<>();
    
    public RoleTable(long owner) {
        this.owner = owner;
    }

    @Override
    public boolean isAuthorized(long account, int roleMask) {
        if (account == 0)
            return false;
        if (account == owner)
            return true;
        Integer r = roles.get(account);
        return (r != null) && ((r & roleMask) != 0);
    }

    @Override
    public long getOwner() {
        return owner;
    }
    
    public int rolesOf(long account) {
        Integer r = roles.get(account);
        return (r == null) ? 0 : r;
    }
    
    void grantRoles(long account, int roleMask) {
        roles.put(account, rolesOf(account) | roleMask);
    }
    
    void revokeRoles(long account, int roleMask) {
        int r = rolesOf(account) & ~roleMask;
        if (r == 0)
            roles.remove(account);
        else
            roles.put(account, r);
    }
    
    void transferOwnership(long newOwner) {
        owner = newOwner;
    }
}
