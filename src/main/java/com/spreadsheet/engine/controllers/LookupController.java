package com.spreadsheet.engine.controllers;

import com.spreadsheet.engine.services.LookupTable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Feeds the data behind ANALYST, ORACLE, PORTFOLIO, BID and TRADEBOT.
 * Sheets pick up new values on their next evaluation.
 */
@RestController
@RequestMapping("/lookup")
public class LookupController {

    @Autowired
    private LookupTable lookupTable;

    /**
     * PUT /lookup/{function}/{key}, e.g. /lookup/BID/AAPL with body "$175.43".
     */
    @PutMapping("/{function}/{key}")
    public ResponseEntity<Void> put(@PathVariable String function,
                                    @PathVariable String key,
                                    @RequestBody String value) {
        lookupTable.put(function, key, value);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /lookup/{function}/{key}/{field}, e.g. /lookup/TRADEBOT/alpha/winrate with body "68.5%".
     */
    @PutMapping("/{function}/{key}/{field}")
    public ResponseEntity<Void> put(@PathVariable String function,
                                    @PathVariable String key,
                                    @PathVariable String field,
                                    @RequestBody String value) {
        lookupTable.put(function, key, field, value);
        return ResponseEntity.ok().build();
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> list() {
        return ResponseEntity.ok(lookupTable.snapshot());
    }
}
