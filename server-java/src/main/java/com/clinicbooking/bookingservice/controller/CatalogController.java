package com.clinicbooking.bookingservice.controller;

import com.clinicbooking.bookingservice.dto.BusinessDto;
import com.clinicbooking.bookingservice.dto.BusinessRequest;
import com.clinicbooking.bookingservice.dto.ServiceOfferingDto;
import com.clinicbooking.bookingservice.dto.ServiceOfferingRequest;
import com.clinicbooking.bookingservice.dto.StaffDto;
import com.clinicbooking.bookingservice.dto.StaffRequest;
import com.clinicbooking.bookingservice.service.CatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PostMapping("/businesses")
    public ResponseEntity<BusinessDto> createBusiness(@Valid @RequestBody BusinessRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createBusiness(request));
    }

    @PutMapping("/businesses/{businessId}")
    public ResponseEntity<BusinessDto> updateBusiness(@PathVariable Long businessId,
                                                      @Valid @RequestBody BusinessRequest request) {
        return ResponseEntity.ok(catalogService.updateBusiness(businessId, request));
    }

    @DeleteMapping("/businesses/{businessId}")
    public ResponseEntity<Void> deleteBusiness(@PathVariable Long businessId) {
        catalogService.deleteBusiness(businessId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/businesses/{businessId}/services")
    public ResponseEntity<List<ServiceOfferingDto>> listServices(@PathVariable Long businessId) {
        return ResponseEntity.ok(catalogService.listServices(businessId));
    }

    @PostMapping("/businesses/{businessId}/services")
    public ResponseEntity<ServiceOfferingDto> createService(@PathVariable Long businessId,
                                                            @Valid @RequestBody ServiceOfferingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createService(businessId, request));
    }

    @PutMapping("/services/{serviceId}")
    public ResponseEntity<ServiceOfferingDto> updateService(@PathVariable Long serviceId,
                                                            @Valid @RequestBody ServiceOfferingRequest request) {
        return ResponseEntity.ok(catalogService.updateService(serviceId, request));
    }

    @PostMapping("/businesses/{businessId}/staff")
    public ResponseEntity<StaffDto> createStaff(@PathVariable Long businessId,
                                                @Valid @RequestBody StaffRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createStaff(businessId, request));
    }

    @DeleteMapping("/staff/{staffId}")
    public ResponseEntity<Void> deleteStaff(@PathVariable Long staffId) {
        catalogService.deleteStaff(staffId);
        return ResponseEntity.noContent().build();
    }
}
