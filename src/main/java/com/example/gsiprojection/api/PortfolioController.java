package com.example.gsiprojection.api;

import com.example.gsiprojection.domain.ReferencePortfolio;
import com.example.gsiprojection.repository.ReferencePortfolioRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/portfolio")
public class PortfolioController {
    // Read-only source of the reference portfolio every projection is scaled from
    private final ReferencePortfolioRepository repository;

    public PortfolioController(ReferencePortfolioRepository repository) {
        this.repository = repository;
    }

    // Returns the reference portfolio so the frontend can show the demo table
    @GetMapping("/reference")
    public ReferencePortfolio reference() {
        return repository.get();
    }
}
