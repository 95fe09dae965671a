package io.chronolayout.api;

import io.chronolayout.core.LayoutEngine;
import io.chronolayout.core.LayoutResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.ZoneOffset;

@RestController
@RequestMapping("/api/layout")
public class LayoutController {
    static final String SKIPPED_HEADER = "X-CL-Skipped";

    private final LayoutEngine engine;
    private final EventParser parser;

    public LayoutController(LayoutEngine engine, EventParser parser) {
        this.engine = engine;
        this.parser = parser;
    }

    @PostMapping
    public ResponseEntity<LayoutResult> layout(@RequestBody LayoutRequest req) {
        var parsed = parse(req);
        var result = engineFor(req).layout(parsed.events(), req.viewport(), req.zoomOrDefault());
        return withSkipped(parsed).body(result);
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidatedLayout> validate(@RequestBody LayoutRequest req) {
        var parsed = parse(req);
        var e = engineFor(req);
        var result = e.layout(parsed.events(), req.viewport(), req.zoomOrDefault());
        var report = e.validate(result, parsed.events(), req.viewport());
        return withSkipped(parsed).body(new ValidatedLayout(result, report));
    }

    @GetMapping("/config")
    public ResponseEntity<ConfigView> config() {
        return ResponseEntity.ok(ConfigView.of(engine));
    }

    private EventParser.Parsed parse(LayoutRequest req) {
        if (req.viewport() == null) throw new IllegalArgumentException("viewport is required");
        return parser.parse(req.events());
    }

    private LayoutEngine engineFor(LayoutRequest req) {
        return req.now() == null ? engine : engine.withClock(Clock.fixed(req.now(), ZoneOffset.UTC));
    }

    private static ResponseEntity.BodyBuilder withSkipped(EventParser.Parsed parsed) {
        var ok = ResponseEntity.ok();
        if (!parsed.skipped().isEmpty()) ok.header(SKIPPED_HEADER, String.join(",", parsed.skipped()));
        return ok;
    }
}
