package dev.mdtree;

import dev.mdtree.cli.MdTreeCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MdTreeCli()).execute(args);
        System.exit(exitCode);
    }
}
