package com.itiac.cli;

import com.itiac.core.analysis.ImpactAnalysisEngine;
import com.itiac.core.config.ImpactConfig;
import com.itiac.core.model.ImpactCause;
import com.itiac.core.model.InfrastructureSnapshot;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command to show what the current outage impacts.
 *
 * <p>Every offline component is an outage root. Each impacted component is listed with
 * the nearest root, the component it is reached through and its hop distance.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * itiac impact snapshot.json
 * itiac impact snapshot.json --visible db-orders,svc-orders,api-shop
 * }</pre>
 */
@Command(
    name = "impact",
    description = "Show components impacted by offline components",
    mixinStandardHelpOptions = true
)
public class ImpactCommand extends SnapshotCommand {

    private static final Logger log = LoggerFactory.getLogger(ImpactCommand.class);

    @Option(
        names = {"--visible"},
        split = ",",
        description = "Only follow edges between these component ids"
    )
    private List<String> visibleIds;

    @Override
    protected int execute(InfrastructureSnapshot snapshot, ImpactConfig config) {
        ImpactAnalysisEngine engine = new ImpactAnalysisEngine(config.scoringPolicy());
        Set<String> visible = visibleIds == null ? null : new LinkedHashSet<>(visibleIds);

        Set<String> roots = snapshot.offlineComponentIds();
        Map<String, ImpactCause> causes = engine.computeImpactCauses(snapshot, visible);
        log.info("{} offline component(s), {} impacted", roots.size(), causes.size());

        System.out.println("Offline components: " + roots.size());
        roots.forEach(id -> System.out.println("  ✗ " + label(snapshot, id)));
        System.out.println();

        System.out.println("Impacted components: " + causes.size());
        if (causes.isEmpty()) {
            System.out.println("  None.");
            return EXIT_OK;
        }
        for (ImpactCause cause : causes.values()) {
            System.out.printf("  • %s  root cause: %s, via %s, %d hop(s)%n",
                label(snapshot, cause.componentId()),
                label(snapshot, cause.rootCauseId()),
                cause.immediateCauseId(),
                cause.hopDistance());
        }
        return EXIT_OK;
    }
}
