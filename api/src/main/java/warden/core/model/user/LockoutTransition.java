package warden.core.model.user;

/**
 * Result of applying a failed login to an account.
 *
 * @param state        updated security state to persist
 * @param becameLocked true if this failure reached the lock threshold
 */
public record LockoutTransition(AccountSecurityState state, boolean becameLocked) {}
