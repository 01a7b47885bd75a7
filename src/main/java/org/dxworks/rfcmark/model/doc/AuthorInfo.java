package org.dxworks.rfcmark.model.doc;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthorInfo {
    public String ins; // "J. Doe" from initials and surname
    public String name;
    public String organization;
    public String email;
    public String uri;
    public String phone;
    public String street;
    public String city;
    public String region;
    public String code;
    public String country;
}
