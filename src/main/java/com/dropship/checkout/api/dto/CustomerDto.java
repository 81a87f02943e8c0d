package com.dropship.checkout.api.dto;

import com.dropship.checkout.domain.Customer;
import jakarta.validation.constraints.Email;
import lombok.Data;

@Data
public class CustomerDto {

    private String name;

    @Email(message = "email must be a valid address")
    private String email;

    private String phone;
    private String address;
    /** Nigerian state; selects the shipping fee. */
    private String state;

    public Customer toCustomer() {
        return Customer.of(name, email, phone, address, state);
    }
}
