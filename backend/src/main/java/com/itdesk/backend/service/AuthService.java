package com.itdesk.backend.service;

import com.itdesk.backend.domain.User;
import com.itdesk.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService implements UserDetailsService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    // Login aceita username ou matrícula
    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        return userRepository.findByUsernameOrEmployeeId(username, username)
                .orElseThrow(() -> new UsernameNotFoundException("User not found: " + username));
    }

    public User authenticate(String username, String password) {
        User user;
        try {
            user = (User) loadUserByUsername(username);
        } catch (UsernameNotFoundException e) {
            log.warn("Login rejected for unknown user '{}'", username);
            throw new BadCredentialsException("Invalid username or password");
        }
        if (!passwordEncoder.matches(password, user.getPassword())) {
            log.warn("Login rejected for user '{}': wrong password", username);
            throw new BadCredentialsException("Invalid username or password");
        }
        return user;
    }
}
