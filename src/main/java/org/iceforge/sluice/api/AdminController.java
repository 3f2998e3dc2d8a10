package org.iceforge.sluice.api;

import org.iceforge.sluice.cache.ContentHashRegistry;
import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.governance.GovernanceConfigHolder;
import org.iceforge.sluice.jdbc.DatabaseNotFoundException;
import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

/**
 * Operator endpoints under {@code /-/}.
 */
@RestController
@RequestMapping("/-")
public class AdminController {
    private final GovernanceConfigHolder configs;
    private final DatabaseProperties databases;
    private final ContentHashRegistry hashes;

    public AdminController(GovernanceConfigHolder configs, DatabaseProperties databases, ContentHashRegistry hashes) {
        this.configs = Objects.requireNonNull(configs);
        this.databases = Objects.requireNonNull(databases);
        this.hashes = Objects.requireNonNull(hashes);
    }

    @GetMapping("/settings")
    public GovernanceConfig settings() {
        return configs.current();
    }

    /** Forget a database's content hash after its file was replaced. */
    @PostMapping("/databases/{database}/invalidate")
    public ResponseEntity<Void> invalidate(@PathVariable String database) {
        if (databases.get(database) == null) {
            throw new DatabaseNotFoundException(database);
        }
        hashes.invalidate(database);
        return ResponseEntity.noContent().build();
    }
}
