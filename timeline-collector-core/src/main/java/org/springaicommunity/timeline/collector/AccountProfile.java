package org.springaicommunity.timeline.collector;

/**
 * Account metadata returned by the source.
 *
 * @param account the account handle
 * @param expectedPostCount the number of posts the source reports for the account, or 0
 * when unknown
 */
public record AccountProfile(String account, int expectedPostCount) {

	public static AccountProfile unknown(String account) {
		return new AccountProfile(account, 0);
	}

	public boolean hasExpectedCount() {
		return expectedPostCount > 0;
	}

}
