package org.springaicommunity.eigen.neovim;

/**
 * A repository that could not be fetched during a crawl.
 *
 * @param fullName repository in "owner/name" format
 * @param reason human-readable cause
 */
public record ItemFailure(String fullName, String reason) {

}
