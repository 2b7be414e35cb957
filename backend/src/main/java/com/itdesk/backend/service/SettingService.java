package com.itdesk.backend.service;

import com.itdesk.backend.domain.Setting;
import com.itdesk.backend.dto.SettingDTOs.SettingRequest;
import com.itdesk.backend.exception.ResourceNotFoundException;
import com.itdesk.backend.repository.SettingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class SettingService {

    public static final String EMAIL_CATEGORY = "email";

    private final SettingRepository settingRepository;

    @Transactional(readOnly = true)
    public List<Setting> list(String category) {
        if (category != null && !category.isBlank()) {
            return settingRepository.findByCategoryOrderByKeyAsc(category);
        }
        return settingRepository.findAllByOrderByKeyAsc();
    }

    @Transactional(readOnly = true)
    public Setting get(String key) {
        return settingRepository.findByKey(key).orElseThrow(() -> ResourceNotFoundException.of("Setting"));
    }

    /** Upsert pela chave: cria ou sobrescreve valor, categoria e descrição. */
    @Transactional
    public Setting upsert(SettingRequest request) {
        Setting setting = settingRepository.findByKey(request.key()).orElseGet(Setting::new);
        setting.setKey(request.key());
        setting.setValue(request.value());
        if (request.category() != null && !request.category().isBlank()) {
            setting.setCategory(request.category());
        }
        setting.setDescription(request.description());
        return settingRepository.save(setting);
    }

    @Transactional
    public List<Setting> upsertAll(List<SettingRequest> requests) {
        return requests.stream().map(this::upsert).toList();
    }

    @Transactional
    public Setting updateValue(String key, String value) {
        Setting setting = get(key);
        setting.setValue(value);
        return settingRepository.save(setting);
    }

    @Transactional(readOnly = true)
    public Map<String, String> asMap(String category) {
        Map<String, String> values = new LinkedHashMap<>();
        list(category).forEach(s -> values.put(s.getKey(), s.getValue()));
        return values;
    }
}
