package com.smurthy.ai.shopping.controllers;

import com.smurthy.ai.shopping.session.SessionState;
import com.smurthy.ai.shopping.session.SessionStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only session view. Unknown ids answer with an empty active session.
 */
@RestController
@RequestMapping("/sessions")
class SessionController {

    private final SessionStore sessionStore;

    public SessionController(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @GetMapping("/{sessionId}")
    public SessionState session(@PathVariable String sessionId) {
        return sessionStore.viewCart(sessionId);
    }
}
