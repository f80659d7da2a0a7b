package com.tracematrix.core.scanner;

import com.tracematrix.core.model.GitBranchRef;
import com.tracematrix.core.reference.RequirementIdMatcher;
import com.tracematrix.core.vcs.VersionControlGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Groups branch names under the requirement they were cut for.
 * <p>
 * {@code feature/req-7-login} and {@code remotes/origin/feature/req-7-login} both become
 * {@code feature/req-7-login} under {@code REQ-007}.
 */
@Service
public class GitBranchScanner {

    private static final Logger log = LoggerFactory.getLogger(GitBranchScanner.class);

    private static final Pattern REMOTE_PREFIX = Pattern.compile("^remotes/[^/]+/");

    private final VersionControlGateway gateway;

    public GitBranchScanner(VersionControlGateway gateway) {
        this.gateway = gateway;
    }

    public SortedMap<String, List<String>> scan() {
        var grouped = new TreeMap<String, TreeSet<String>>();
        for (GitBranchRef ref : branchRefs()) {
            grouped.computeIfAbsent(ref.requirementId(), k -> new TreeSet<>()).add(ref.branchName());
        }
        var result = new TreeMap<String, List<String>>();
        grouped.forEach((id, names) -> result.put(id, List.copyOf(names)));
        log.info("Found branches for {} requirement(s)", result.size());
        return result;
    }

    /** Every branch that carries a requirement ID, one entry per listed branch. */
    public List<GitBranchRef> branchRefs() {
        var refs = new ArrayList<GitBranchRef>();
        for (String raw : gateway.listBranches()) {
            String branchName = REMOTE_PREFIX.matcher(raw.trim()).replaceFirst("");
            Optional<String> id = RequirementIdMatcher.normalizedIdIn(branchName);
            id.ifPresent(reqId -> refs.add(new GitBranchRef(reqId, branchName)));
        }
        return refs;
    }
}
