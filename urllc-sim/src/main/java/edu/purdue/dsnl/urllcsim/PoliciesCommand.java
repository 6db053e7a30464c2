package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.policy.PolicyType;

import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "policies", description = "List the accepted scheduling policy names")
public class PoliciesCommand implements Callable<Integer> {
    @Override
    public Integer call() {
        for (var t : PolicyType.values()) {
            System.out.println(t.getConfigName());
        }
        return 0;
    }
}
