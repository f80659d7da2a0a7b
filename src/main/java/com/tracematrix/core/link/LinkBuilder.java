package com.tracematrix.core.link;

import com.tracematrix.core.logging.MdcContext;
import com.tracematrix.core.model.ComplianceFrameworkCoverage;
import com.tracematrix.core.model.ComplianceLink;
import com.tracematrix.core.model.FeatureLink;
import com.tracematrix.core.model.FeatureRecord;
import com.tracematrix.core.model.Requirement;
import com.tracematrix.core.model.ScanResult;
import com.tracematrix.core.model.TestRecord;
import com.tracematrix.core.model.TraceabilityLink;
import com.tracematrix.core.reference.RequirementIdMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Joins the scanner outputs into one {@link TraceabilityLink} per requirement.
 * <p>
 * Links are produced only for scanned requirements, so the result never contains an ID
 * that is absent from {@link ScanResult#requirements()}.
 */
@Service
public class LinkBuilder {

    private static final Logger log = LoggerFactory.getLogger(LinkBuilder.class);

    private final ImplementationLocator implementationLocator;

    public LinkBuilder(ImplementationLocator implementationLocator) {
        this.implementationLocator = implementationLocator;
    }

    public SortedMap<String, TraceabilityLink> build(ScanResult scan) {
        var links = new TreeMap<String, TraceabilityLink>();
        for (Requirement requirement : scan.requirements().values()) {
            String id = requirement.id();
            MdcContext.setRequirement(id);
            try {
                links.put(id, new TraceabilityLink(
                        testsFor(id, scan),
                        scan.gitBranches().getOrDefault(id, List.of()),
                        implementationLocator.findImplementationFiles(id),
                        complianceFor(requirement, scan),
                        featuresFor(id, scan)
                ));
            } finally {
                MdcContext.clearRequirement();
            }
        }
        log.info("Built traceability links for {} requirement(s)", links.size());
        return links;
    }

    private static List<String> testsFor(String id, ScanResult scan) {
        var tests = new ArrayList<String>();
        for (TestRecord test : scan.tests().values()) {
            if (test.references(id)) {
                tests.add(test.filePath());
            }
        }
        return tests;
    }

    private static List<ComplianceLink> complianceFor(Requirement requirement, ScanResult scan) {
        var frameworks = new ArrayList<ComplianceLink>();
        for (String standard : requirement.complianceStandards()) {
            ComplianceFrameworkCoverage coverage = scan.complianceFrameworks().get(standard);
            if (coverage == null) {
                log.debug("{} lists unmapped compliance standard {}", requirement.id(), standard);
                continue;
            }
            frameworks.add(ComplianceLink.of(coverage));
        }
        return frameworks;
    }

    private static List<FeatureLink> featuresFor(String id, ScanResult scan) {
        var features = new ArrayList<FeatureLink>();
        for (FeatureRecord feature : scan.features().values()) {
            boolean listed = feature.requirements().stream()
                    .anyMatch(ref -> RequirementIdMatcher.matches(ref, id));
            if (listed) {
                features.add(new FeatureLink(feature.name(), feature.domain(), feature.phase()));
            }
        }
        return features;
    }
}
