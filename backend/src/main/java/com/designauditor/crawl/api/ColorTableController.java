package com.designauditor.crawl.api;

import com.designauditor.color.ColorConsolidationEngine;
import com.designauditor.color.ColorObservation;
import com.designauditor.color.ColorSummary;
import com.designauditor.color.ColorTable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/colors")
public class ColorTableController {
    private final ColorConsolidationEngine engine;

    public ColorTableController(ColorConsolidationEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/consolidate")
    public ColorConsolidationResponse consolidate(@RequestBody List<ColorObservation> observations) {
        ColorTable table = engine.consolidate(observations);
        return new ColorConsolidationResponse(table, engine.deriveSummary(table));
    }

    public record ColorConsolidationResponse(ColorTable table, ColorSummary summary) {
    }
}
