package com.phillippitts.strokecoach.presentation.controller;

import com.phillippitts.strokecoach.service.corpus.ReferenceCorpus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Re-reads the reference corpus after offline ingestion. Requests in flight keep the
 * snapshot they started with.
 */
@RestController
class CorpusController {

    private static final Logger LOG = LogManager.getLogger(CorpusController.class);

    private final ReferenceCorpus corpus;

    CorpusController(ReferenceCorpus corpus) {
        this.corpus = corpus;
    }

    @PostMapping("/corpus/reload")
    ResponseEntity<Map<String, Integer>> reload() {
        int entries = corpus.reload();
        LOG.info("Reference corpus reloaded: {} entries", entries);
        return ResponseEntity.ok(Map.of("entries", entries));
    }
}
