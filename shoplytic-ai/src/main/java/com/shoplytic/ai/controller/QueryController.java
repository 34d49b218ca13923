package com.shoplytic.ai.controller;

import com.shoplytic.ai.dto.QueryRequest;
import com.shoplytic.ai.dto.QueryResponse;
import com.shoplytic.ai.service.QueryService;
import com.shoplytic.common.web.SessionIdResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Shopping assistant endpoint.
 * <p>
 * The session is derived from the caller's address, so no session header
 * or cookie is needed.
 */
@RestController
@RequestMapping("/user")
@RequiredArgsConstructor
public class QueryController {

    private final QueryService queryService;

    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request,
                                               HttpServletRequest httpRequest) {
        return ResponseEntity.ok(queryService.answer(request, SessionIdResolver.resolve(httpRequest)));
    }
}
