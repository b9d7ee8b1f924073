package com.hedgetrader.account;

import com.hedgetrader.config.TradingConfiguration;
import com.hedgetrader.domain.enums.LockCause;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.exception.ReservationException;
import com.hedgetrader.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owner of all live account state: balances, reservations, locks, active-order counts and
 * daily loss/trade counters.
 *
 * <p>Every operation is atomic from the caller's view. Reservation is exclusive: once an
 * account is reserved for a hedge, no other hedge can reserve it until that hedge releases
 * it. {@link #reserveAll} reserves a whole set of accounts or none of them.
 *
 * <p>Daily counters reset on the first access of a new day, with the date taken from the
 * injected {@link Clock}.
 *
 * <p><b>Thread safety:</b> all public methods synchronize on the registry. The registry never
 * calls out to other components while holding its monitor. Accounts returned to callers are
 * detached copies.
 */
@Component
public class AccountRegistry {

    private static final Logger log = LoggerFactory.getLogger(AccountRegistry.class);

    private final Clock clock;
    private final Map<String, Account> accounts = new LinkedHashMap<>();

    private LocalDate currentDate;

    public AccountRegistry(TradingConfiguration tradingConfiguration, Clock clock) {
        this.clock = clock;
        this.currentDate = LocalDate.now(clock);
        for (Account account : tradingConfiguration.getAccounts()) {
            Account live = account.copy();
            live.setLastResetDate(currentDate);
            accounts.put(live.getAddress(), live);
        }
        log.info("AccountRegistry initialized with {} accounts", accounts.size());
    }

    // ========================
    // QUERIES
    // ========================

    public synchronized Account getAccount(String address) {
        resetDailyCountersIfNeeded();
        return require(address).copy();
    }

    public synchronized List<Account> getAccounts() {
        resetDailyCountersIfNeeded();
        List<Account> copies = new ArrayList<>();
        accounts.values().forEach(account -> copies.add(account.copy()));
        return copies;
    }

    /** Copies of the given accounts in the given order. Unknown addresses are skipped. */
    public synchronized List<Account> getAccounts(Collection<String> addresses) {
        resetDailyCountersIfNeeded();
        List<Account> copies = new ArrayList<>();
        for (String address : addresses) {
            Account account = accounts.get(address);
            if (account != null) {
                copies.add(account.copy());
            }
        }
        return copies;
    }

    public synchronized BigDecimal getTotalDailyLoss() {
        resetDailyCountersIfNeeded();
        return accounts.values().stream().map(Account::getDailyLoss).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    // ========================
    // RESERVATION
    // ========================

    /**
     * Reserves one account for a hedge.
     *
     * @throws ReservationException if the account is locked, already reserved, out of daily
     *     trades, or its available balance is below {@code amount}
     */
    public synchronized void reserveForHedge(String address, String hedgeId, String pairId, BigDecimal amount) {
        resetDailyCountersIfNeeded();
        Account account = require(address);
        verifyReservable(account, amount);
        applyReservation(account, hedgeId, pairId, amount);
        log.debug("Reserved account {} for hedge {} ({})", address, hedgeId, amount);
    }

    /**
     * Reserves every listed account for one hedge, or none of them. Nothing changes if any
     * account fails verification.
     *
     * @throws ReservationException for the first account that cannot be reserved
     */
    public synchronized void reserveAll(List<String> addresses, String hedgeId, String pairId, BigDecimal amount) {
        resetDailyCountersIfNeeded();
        List<Account> targets = new ArrayList<>();
        for (String address : addresses) {
            Account account = require(address);
            verifyReservable(account, amount);
            targets.add(account);
        }
        targets.forEach(account -> applyReservation(account, hedgeId, pairId, amount));
        log.debug("Reserved accounts {} for hedge {} ({} each)", addresses, hedgeId, amount);
    }

    /**
     * Releases the account if it is reserved by {@code hedgeId}.
     *
     * @return true if a reservation was released
     */
    public synchronized boolean release(String address, String hedgeId) {
        Account account = require(address);
        if (!hedgeId.equals(account.getReservedByHedgeId())) {
            return false;
        }
        clearReservation(account);
        log.debug("Released account {} from hedge {}", address, hedgeId);
        return true;
    }

    /** Releases every account reserved by {@code hedgeId}. Returns the number released. */
    public synchronized int releaseAll(String hedgeId) {
        int released = 0;
        for (Account account : accounts.values()) {
            if (hedgeId.equals(account.getReservedByHedgeId())) {
                clearReservation(account);
                released++;
            }
        }
        return released;
    }

    // ========================
    // FILLS & BALANCES
    // ========================

    /**
     * Books the realized P&L of one closed leg: adjusts the balance, adds losses to the daily
     * loss accumulator and counts the trade.
     */
    public synchronized void recordFill(String address, BigDecimal pnl) {
        resetDailyCountersIfNeeded();
        Account account = require(address);
        account.setBalance(account.getBalance().add(pnl));
        if (pnl.signum() < 0) {
            account.setDailyLoss(account.getDailyLoss().add(pnl.negate()));
        }
        account.setDailyTrades(account.getDailyTrades() + 1);
        log.debug("Recorded fill on {}: pnl={}, balance={}, dailyLoss={}, dailyTrades={}",
                address, pnl, account.getBalance(), account.getDailyLoss(), account.getDailyTrades());
    }

    /** Replaces the account balance with an externally observed value. */
    public synchronized void updateBalance(String address, BigDecimal balance) {
        require(address).setBalance(balance);
    }

    public synchronized void incrementActiveOrders(String address) {
        Account account = require(address);
        account.setActiveOrders(account.getActiveOrders() + 1);
    }

    public synchronized void decrementActiveOrders(String address) {
        Account account = require(address);
        account.setActiveOrders(Math.max(0, account.getActiveOrders() - 1));
    }

    // ========================
    // LOCKING
    // ========================

    /**
     * Locks the account so it cannot join a new hedge. An already locked account keeps its
     * original cause and reason.
     *
     * @return true if the account was unlocked before this call
     */
    public synchronized boolean lock(String address, LockCause cause, String reason) {
        Account account = require(address);
        if (account.isLocked()) {
            return false;
        }
        account.setLocked(true);
        account.setLockCause(cause);
        account.setLockReason(reason);
        log.warn("Account {} locked ({}): {}", address, cause, reason);
        return true;
    }

    /** Operator unlock, whatever the lock cause. Returns true if the account was locked. */
    public synchronized boolean unlock(String address) {
        Account account = require(address);
        if (!account.isLocked()) {
            return false;
        }
        clearLock(account);
        log.info("Account {} unlocked", address);
        return true;
    }

    /** Locks every account that is not locked yet. Returns the number newly locked. */
    public synchronized int lockAll(LockCause cause, String reason) {
        int locked = 0;
        for (Account account : accounts.values()) {
            if (!account.isLocked()) {
                account.setLocked(true);
                account.setLockCause(cause);
                account.setLockReason(reason);
                locked++;
            }
        }
        log.warn("Locked {} accounts ({}): {}", locked, cause, reason);
        return locked;
    }

    /** Unlocks only the accounts locked with {@code cause}. Returns the number unlocked. */
    public synchronized int unlockAll(LockCause cause) {
        int unlocked = 0;
        for (Account account : accounts.values()) {
            if (account.isLocked() && account.getLockCause() == cause) {
                clearLock(account);
                unlocked++;
            }
        }
        log.info("Unlocked {} accounts previously locked by {}", unlocked, cause);
        return unlocked;
    }

    // ========================
    // DAILY RESET
    // ========================

    /** Resets daily loss and trade counters when the clock has moved to a new day. */
    private void resetDailyCountersIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(currentDate)) {
            return;
        }
        for (Account account : accounts.values()) {
            account.setDailyLoss(BigDecimal.ZERO);
            account.setDailyTrades(0);
            account.setLastResetDate(today);
        }
        log.info("Daily account counters reset for {} (previous day: {})", today, currentDate);
        currentDate = today;
    }

    private void verifyReservable(Account account, BigDecimal amount) {
        String address = account.getAddress();
        if (account.isLocked()) {
            throw new ReservationException(address, "Account " + address + " is locked: " + account.getLockReason());
        }
        if (account.isReserved()) {
            throw new ReservationException(
                    address, "Account " + address + " is reserved by hedge " + account.getReservedByHedgeId());
        }
        if (!account.hasTradesRemaining()) {
            throw new ReservationException(address, "Account " + address + " reached its daily trade limit");
        }
        if (account.getAvailableBalance().compareTo(amount) < 0) {
            throw new ReservationException(address, "Account " + address + " has insufficient balance: "
                    + account.getAvailableBalance() + " < " + amount);
        }
    }

    private void applyReservation(Account account, String hedgeId, String pairId, BigDecimal amount) {
        account.setReservedByHedgeId(hedgeId);
        account.setReservedForPairId(pairId);
        account.setReserved(amount);
    }

    private void clearReservation(Account account) {
        account.setReservedByHedgeId(null);
        account.setReservedForPairId(null);
        account.setReserved(BigDecimal.ZERO);
    }

    private void clearLock(Account account) {
        account.setLocked(false);
        account.setLockCause(null);
        account.setLockReason(null);
    }

    private Account require(String address) {
        Account account = accounts.get(address);
        if (account == null) {
            throw new ResourceNotFoundException("Account", address);
        }
        return account;
    }
}
