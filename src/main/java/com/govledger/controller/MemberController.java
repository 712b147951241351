package com.govledger.controller;

import com.govledger.domain.Member;
import com.govledger.dto.ApiResponses;
import com.govledger.dto.RegisterMemberRequest;
import com.govledger.service.MemberService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for member registration.
 */
@RestController
@RequestMapping("/members")
@Tag(name = "Members", description = "Identity registration")
public class MemberController {

    private final MemberService memberService;

    public MemberController(MemberService memberService) {
        this.memberService = memberService;
    }

    @PostMapping("/register")
    @Operation(summary = "Register member", description = "Registers an address with a password for sign-in")
    public ResponseEntity<ApiResponses.MemberResponse> register(
            @Valid @RequestBody RegisterMemberRequest request) {
        Member member = memberService.register(request.getAddress(), request.getPassword());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new ApiResponses.MemberResponse(member));
    }
}
