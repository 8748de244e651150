package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

/**
 * Login credentials for the remote source.
 *
 * @param username account used to log in
 * @param password password for that account
 * @param email optional email, some sources ask for it as a login challenge
 */
public record Credentials(String username, String password, @Nullable String email) {

	@Override
	public String toString() {
		return "Credentials{username='" + username + "', password='***'}";
	}

}
