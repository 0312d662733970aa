///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//DEPS org.springaicommunity:eigen-neovim-cli:1.0.0-SNAPSHOT

import org.springaicommunity.eigen.neovim.cli.EigenNeovimCli;

public class eigen {
    public static void main(String[] args) throws Exception {
        EigenNeovimCli.main(args);
    }
}
