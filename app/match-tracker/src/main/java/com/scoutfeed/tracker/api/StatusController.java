/*
 * Where: Match tracker API
 * What: answers the root path with a plain liveness line
 * Why: load balancers and operators probe / without going through actuator
 */
package com.scoutfeed.tracker.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "match-tracker: ok";
  }
}
