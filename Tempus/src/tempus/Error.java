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

/**
 * Error codes returned (thrown, inside a LedgerException) by the ledger.
 * Each hundred-range maps to one ErrorKind.
 */
public class Error {
    
    // Not error:
    
    public static final int OK                                  = 0;
    
    // Validation errors (malformed parameters):
    
    public static final int INVALID_ACCOUNT                     = -100;
    public static final int INVALID_AMOUNT                      = -101;
    public static final int INVALID_TIER_PARAMS                 = -102;
    public static final int INVALID_CURVE_PARAMS                = -103;
    public static final int INVALID_FEE_PARAMS                  = -104;
    public static final int INVALID_REFERRAL_PARAMS             = -105;
    public static final int INVALID_REWARD_PARAMS               = -106;
    public static final int INVALID_SUPPLY_CAP                  = -107;
    public static final int INVALID_INIT_PARAMS                 = -108;
    public static final int TIER_NOT_FOUND                      = -109;
    public static final int CURVE_NOT_FOUND                     = -110;
    public static final int OVERFLOW                            = -111;
    
    // Authorization errors:
    
    public static final int UNAUTHORIZED                        = -200;
    
    // Insufficient funds:
    
    public static final int INVALID_CAPTURE                     = -300;
    public static final int INSUFFICIENT_BALANCE                = -301;
    public static final int PURCHASE_TOO_SMALL                  = -302;
    public static final int TRANSFER_FAILED                     = -303;
    
    // Capacity exceeded:
    
    public static final int TIER_SUPPLY_EXCEEDED                = -400;
    public static final int GLOBAL_SUPPLY_EXCEEDED              = -401;
    public static final int MAX_COMMITMENT_EXCEEDED             = -402;
    
    // State conflicts:
    
    public static final int TIER_INVALID_SWITCH                 = -500;
    public static final int DESTINATION_HAS_SUBSCRIPTION        = -501;
    public static final int TIER_PAUSED                         = -502;
    public static final int TIER_NOT_STARTED                    = -503;
    public static final int TIER_ENDED                          = -504;
    public static final int TRANSFER_NOT_ALLOWED                = -505;
    public static final int REFERRAL_LOCKED                     = -506;
    public static final int REENTRANT_CALL                      = -507;
    public static final int NO_SUBSCRIPTION                     = -508;
    public static final int POOL_EMPTY                          = -509;
    public static final int ALREADY_INITIALIZED                 = -510;
    public static final int NOT_INITIALIZED                     = -511;
    public static final int NOTHING_TO_DO                       = -512;
    
    // Not eligible:
    
    public static final int NOT_SLASHABLE                       = -600;
    public static final int NOT_FEE_RECIPIENT                   = -601;
    
    public static final int NEVER_HAPPENS                       = -1000;
    public static final int EXCEPTION_NEVER_HAPPENS             = -1001;
    
    // ======================================================================
    
    public static ErrorKind kindOf(int code) {
        if (code == OK)
            return ErrorKind.NONE;
        switch (-code / 100) {
            case 1: return ErrorKind.VALIDATION;
            case 2: return ErrorKind.AUTHORIZATION;
            case 3: return ErrorKind.INSUFFICIENT_FUNDS;
            case 4: return ErrorKind.CAPACITY_EXCEEDED;
            case 5: return ErrorKind.STATE_CONFLICT;
            case 6: return ErrorKind.NOT_ELIGIBLE;
            default: return ErrorKind.INTERNAL;
        }
    }
    
    // Symbolic name of an error code, for logs and exception messages.
    public static String nameOf(int code) {
        switch (code) {
            case OK: return "OK";
            case INVALID_ACCOUNT: return "INVALID_ACCOUNT";
            case INVALID_AMOUNT: return "INVALID_AMOUNT";
            case INVALID_TIER_PARAMS: return "INVALID_TIER_PARAMS";
            case INVALID_CURVE_PARAMS: return "INVALID_CURVE_PARAMS";
            case INVALID_FEE_PARAMS: return "INVALID_FEE_PARAMS";
            case INVALID_REFERRAL_PARAMS: return "INVALID_REFERRAL_PARAMS";
            case INVALID_REWARD_PARAMS: return "INVALID_REWARD_PARAMS";
            case INVALID_SUPPLY_CAP: return "INVALID_SUPPLY_CAP";
            case INVALID_INIT_PARAMS: return "INVALID_INIT_PARAMS";
            case TIER_NOT_FOUND: return "TIER_NOT_FOUND";
            case CURVE_NOT_FOUND: return "CURVE_NOT_FOUND";
            case OVERFLOW: return "OVERFLOW";
            case UNAUTHORIZED: return "UNAUTHORIZED";
            case INVALID_CAPTURE: return "INVALID_CAPTURE";
            case INSUFFICIENT_BALANCE: return "INSUFFICIENT_BALANCE";
            case PURCHASE_TOO_SMALL: return "PURCHASE_TOO_SMALL";
            case TRANSFER_FAILED: return "TRANSFER_FAILED";
            case TIER_SUPPLY_EXCEEDED: return "TIER_SUPPLY_EXCEEDED";
            case GLOBAL_SUPPLY_EXCEEDED: return "GLOBAL_SUPPLY_EXCEEDED";
            case MAX_COMMITMENT_EXCEEDED: return "MAX_COMMITMENT_EXCEEDED";
            case TIER_INVALID_SWITCH: return "TIER_INVALID_SWITCH";
            case DESTINATION_HAS_SUBSCRIPTION: return "DESTINATION_HAS_SUBSCRIPTION";
            case TIER_PAUSED: return "TIER_PAUSED";
            case TIER_NOT_STARTED: return "TIER_NOT_STARTED";
            case TIER_ENDED: return "TIER_ENDED";
            case TRANSFER_NOT_ALLOWED: return "TRANSFER_NOT_ALLOWED";
            case REFERRAL_LOCKED: return "REFERRAL_LOCKED";
            case REENTRANT_CALL: return "REENTRANT_CALL";
            case NO_SUBSCRIPTION: return "NO_SUBSCRIPTION";
            case POOL_EMPTY: return "POOL_EMPTY";
            case ALREADY_INITIALIZED: return "ALREADY_INITIALIZED";
            case NOT_INITIALIZED: return "NOT_INITIALIZED";
            case NOTHING_TO_DO: return "NOTHING_TO_DO";
            case NOT_SLASHABLE: return "NOT_SLASHABLE";
            case NOT_FEE_RECIPIENT: return "NOT_FEE_RECIPIENT";
            case NEVER_HAPPENS: return "NEVER_HAPPENS";
            case EXCEPTION_NEVER_HAPPENS: return "EXCEPTION_NEVER_HAPPENS";
            default: return "ERROR_" + code;
        }
    }
}
