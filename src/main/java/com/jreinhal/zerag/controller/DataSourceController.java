package com.jreinhal.zerag.controller;

import com.jreinhal.zerag.dto.SyncStatus;
import com.jreinhal.zerag.model.DataSource;
import com.jreinhal.zerag.service.DataSourceService;
import com.jreinhal.zerag.sync.SyncService;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/data-sources")
public class DataSourceController {

    static final String USER_HEADER = "X-User-Id";
    static final String ROLE_HEADER = "X-User-Role";

    private final DataSourceService dataSourceService;
    private final SyncService syncService;

    public DataSourceController(DataSourceService dataSourceService, SyncService syncService) {
        this.dataSourceService = dataSourceService;
        this.syncService = syncService;
    }

    @PostMapping
    public ResponseEntity<DataSource> create(@RequestBody DataSource request,
                                             @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(this.dataSourceService.create(request, userId));
    }

    @GetMapping
    public List<DataSource> list(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                 @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        return this.dataSourceService.list(userId, "admin".equalsIgnoreCase(role));
    }

    @GetMapping("/{id}")
    public DataSource get(@PathVariable String id) {
        return this.dataSourceService.get(id);
    }

    @PatchMapping("/{id}")
    public DataSource update(@PathVariable String id, @RequestBody DataSource patch) {
        return this.dataSourceService.update(id, patch);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        this.dataSourceService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/test")
    public Map<String, Object> testConnection(@PathVariable String id) {
        return Map.of("connected", this.dataSourceService.testConnection(id));
    }

    // 409 while a sync is running, via GlobalExceptionHandler.
    @PostMapping("/{id}/sync")
    public ResponseEntity<Map<String, Object>> sync(@PathVariable String id) {
        this.syncService.requestSync(id);
        return ResponseEntity.accepted().body(Map.of("dataSourceId", id, "status", "scheduled"));
    }

    @GetMapping("/{id}/sync-status")
    public SyncStatus syncStatus(@PathVariable String id) {
        return this.syncService.syncStatus(id);
    }

    @PutMapping(value = "/{id}/files/{filename}", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public DataSource uploadFile(@PathVariable String id, @PathVariable String filename, @RequestBody byte[] content) {
        return this.dataSourceService.addUploadedFile(id, filename, content);
    }

    @DeleteMapping("/{id}/files/{filename}")
    public DataSource removeFile(@PathVariable String id, @PathVariable String filename) {
        return this.dataSourceService.removeUploadedFile(id, filename);
    }
}
