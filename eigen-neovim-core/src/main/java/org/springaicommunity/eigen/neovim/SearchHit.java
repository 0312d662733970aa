package org.springaicommunity.eigen.neovim;

/**
 * One code search result: a matching file in a repository.
 *
 * @param fullName repository in "owner/name" format
 * @param path path of the matched file inside the repository
 * @param htmlUrl web URL of the repository
 */
public record SearchHit(String fullName, String path, String htmlUrl) {

}
