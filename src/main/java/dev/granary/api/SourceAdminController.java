package dev.granary.api;

import dev.granary.source.SourceConfig;
import dev.granary.source.SourceConfigService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read access to the loaded source configurations and a manual reload. */
@RestController
@RequestMapping("/api/sources")
public class SourceAdminController {

  private final SourceConfigService sourceConfigService;

  public SourceAdminController(SourceConfigService sourceConfigService) {
    this.sourceConfigService = sourceConfigService;
  }

  @GetMapping
  public List<SourceConfig> listSources() {
    return sourceConfigService.getAllConfigs();
  }

  /** Re-read configurations; a change triggers job re-synchronisation. */
  @PostMapping("/reload")
  public Map<String, Object> reload() {
    boolean changed = sourceConfigService.reload();
    return Map.of("changed", changed, "sources", sourceConfigService.getAllConfigs().size());
  }
}
