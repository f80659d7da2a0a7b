package com.tracematrix.core.link;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.model.CommitRecord;
import com.tracematrix.core.vcs.VersionControlGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.TreeSet;

/**
 * Finds the implementation files of a requirement from commit history: the union of paths
 * touched by commits whose message mentions the requirement ID, kept only when
 * {@link PathClassifier} calls them implementation code.
 * <p>
 * No matching commits is a normal outcome and yields an empty list.
 */
@Service
public class ImplementationLocator {

    private static final Logger log = LoggerFactory.getLogger(ImplementationLocator.class);

    private final VersionControlGateway gateway;
    private final PathClassifier classifier;

    @Autowired
    public ImplementationLocator(VersionControlGateway gateway, TraceabilityConfig config) {
        this(gateway, new PathClassifier(config.implementationIncludes(), config.implementationExcludes()));
    }

    public ImplementationLocator(VersionControlGateway gateway, PathClassifier classifier) {
        this.gateway = gateway;
        this.classifier = classifier;
    }

    /**
     * @param requirementId the ID searched for in commit messages
     * @return sorted, de-duplicated implementation paths
     */
    public List<String> findImplementationFiles(String requirementId) {
        List<CommitRecord> commits;
        try {
            commits = gateway.findCommitsReferencing(requirementId);
        } catch (RuntimeException e) {
            log.warn("Commit lookup failed for {}: {}", requirementId, e.getMessage());
            return List.of();
        }

        var files = new TreeSet<String>();
        for (CommitRecord commit : commits) {
            for (String file : commit.files()) {
                if (classifier.isImplementation(file)) {
                    files.add(file);
                }
            }
        }
        log.debug("{}: {} commit(s), {} implementation file(s)", requirementId, commits.size(), files.size());
        return List.copyOf(files);
    }
}
