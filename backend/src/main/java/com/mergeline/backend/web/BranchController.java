package com.mergeline.backend.web;

import com.mergeline.backend.registry.BranchEntity;
import com.mergeline.backend.registry.BranchService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/branches")
public class BranchController {

    private final BranchService service;

    public BranchController(BranchService service) {
        this.service = service;
    }

    @PostMapping("/{branchId}/deactivate")
    public Map<String, Object> deactivate(
            @PathVariable Long branchId,
            @RequestHeader(value = "X-User", defaultValue = "operator") String user
    ) {
        BranchEntity branch = service.deactivate(branchId, user);
        return Map.of("status", "ok", "branch", branch.getName(), "active", branch.isActive());
    }
}
