package io.b2mash.reportengine.catalog;

import static io.b2mash.reportengine.catalog.SemanticType.ARRAY;
import static io.b2mash.reportengine.catalog.SemanticType.BOOLEAN;
import static io.b2mash.reportengine.catalog.SemanticType.DATETIME;
import static io.b2mash.reportengine.catalog.SemanticType.INTEGER;
import static io.b2mash.reportengine.catalog.SemanticType.REFERENCE;
import static io.b2mash.reportengine.catalog.SemanticType.STRING;

import io.b2mash.reportengine.source.SourceKind;
import java.util.List;

/**
 * Fields every backend of a source is known to expose. Discovery starts from these and adds what
 * the backend schema reports on top.
 */
public final class StandardFields {

  /** Derived directory field computed from the account-disabled bit of userAccountControl. */
  public static final String DIRECTORY_ENABLED = "enabled";

  private StandardFields() {}

  public static List<FieldDescriptor> forSource(SourceKind source) {
    return switch (source) {
      case DIRECTORY -> directory();
      case CLOUD_DIRECTORY -> cloudDirectory();
      case CLOUD_SUITE -> cloudSuite();
    };
  }

  private static List<FieldDescriptor> directory() {
    var s = SourceKind.DIRECTORY;
    return List.of(
        FieldDescriptor.builder("accountName", STRING, s)
            .displayName("Account Name")
            .nativeName("sAMAccountName")
            .category("identity")
            .aliases("username", "samAccountName")
            .description("Pre-Windows 2000 logon name")
            .build(),
        FieldDescriptor.builder("userPrincipalName", STRING, s)
            .displayName("User Principal Name")
            .category("identity")
            .aliases("upn")
            .build(),
        FieldDescriptor.builder("displayName", STRING, s)
            .displayName("Display Name")
            .category("identity")
            .build(),
        FieldDescriptor.builder("firstName", STRING, s)
            .displayName("First Name")
            .nativeName("givenName")
            .category("identity")
            .build(),
        FieldDescriptor.builder("lastName", STRING, s)
            .displayName("Last Name")
            .nativeName("sn")
            .category("identity")
            .aliases("surname")
            .build(),
        FieldDescriptor.builder("email", STRING, s)
            .displayName("Email")
            .nativeName("mail")
            .category("contact")
            .aliases("emailAddress")
            .build(),
        FieldDescriptor.builder("telephoneNumber", STRING, s)
            .displayName("Telephone")
            .category("contact")
            .aliases("phone")
            .build(),
        FieldDescriptor.builder("mobile", STRING, s)
            .displayName("Mobile")
            .category("contact")
            .build(),
        FieldDescriptor.builder("department", STRING, s)
            .displayName("Department")
            .category("organization")
            .build(),
        FieldDescriptor.builder("title", STRING, s)
            .displayName("Job Title")
            .category("organization")
            .aliases("jobTitle")
            .build(),
        FieldDescriptor.builder("company", STRING, s)
            .displayName("Company")
            .category("organization")
            .build(),
        FieldDescriptor.builder("office", STRING, s)
            .displayName("Office")
            .nativeName("physicalDeliveryOfficeName")
            .category("organization")
            .build(),
        FieldDescriptor.builder("employeeId", STRING, s)
            .displayName("Employee ID")
            .nativeName("employeeID")
            .category("organization")
            .build(),
        FieldDescriptor.builder("manager", REFERENCE, s)
            .displayName("Manager")
            .category("organization")
            .description("Distinguished name of the manager")
            .build(),
        FieldDescriptor.builder("memberOf", ARRAY, s)
            .displayName("Group Memberships")
            .category("membership")
            .aliases("groups")
            .build(),
        FieldDescriptor.builder("distinguishedName", STRING, s)
            .displayName("Distinguished Name")
            .category("identity")
            .aliases("dn")
            .build(),
        FieldDescriptor.builder("description", STRING, s)
            .displayName("Description")
            .category("general")
            .build(),
        FieldDescriptor.builder(DIRECTORY_ENABLED, BOOLEAN, s)
            .displayName("Enabled")
            .nativeName("userAccountControl")
            .category("security")
            .description("Derived from the account-disabled flag of userAccountControl")
            .build(),
        FieldDescriptor.builder("userAccountControl", INTEGER, s)
            .displayName("Account Control Flags")
            .category("security")
            .build(),
        FieldDescriptor.builder("badPasswordCount", INTEGER, s)
            .displayName("Bad Password Count")
            .nativeName("badPwdCount")
            .category("security")
            .build(),
        FieldDescriptor.builder("lastLogon", DATETIME, s)
            .displayName("Last Logon")
            .nativeName("lastLogonTimestamp")
            .category("activity")
            .build(),
        FieldDescriptor.builder("passwordLastSet", DATETIME, s)
            .displayName("Password Last Set")
            .nativeName("pwdLastSet")
            .category("security")
            .sensitive()
            .build(),
        FieldDescriptor.builder("accountExpires", DATETIME, s)
            .displayName("Account Expires")
            .category("security")
            .build(),
        FieldDescriptor.builder("lockoutTime", DATETIME, s)
            .displayName("Lockout Time")
            .category("security")
            .build(),
        FieldDescriptor.builder("whenCreated", DATETIME, s)
            .displayName("Created")
            .category("activity")
            .aliases("createdAt")
            .build(),
        FieldDescriptor.builder("whenChanged", DATETIME, s)
            .displayName("Last Modified")
            .category("activity")
            .build());
  }

  private static List<FieldDescriptor> cloudDirectory() {
    var s = SourceKind.CLOUD_DIRECTORY;
    return List.of(
        FieldDescriptor.builder("id", STRING, s)
            .displayName("Object ID")
            .category("identity")
            .build(),
        FieldDescriptor.builder("userPrincipalName", STRING, s)
            .displayName("User Principal Name")
            .category("identity")
            .aliases("upn")
            .build(),
        FieldDescriptor.builder("displayName", STRING, s)
            .displayName("Display Name")
            .category("identity")
            .build(),
        FieldDescriptor.builder("givenName", STRING, s)
            .displayName("First Name")
            .category("identity")
            .aliases("firstName")
            .build(),
        FieldDescriptor.builder("surname", STRING, s)
            .displayName("Last Name")
            .category("identity")
            .aliases("lastName")
            .build(),
        FieldDescriptor.builder("mail", STRING, s)
            .displayName("Email")
            .category("contact")
            .aliases("email")
            .build(),
        FieldDescriptor.builder("mobilePhone", STRING, s)
            .displayName("Mobile")
            .category("contact")
            .build(),
        FieldDescriptor.builder("businessPhones", ARRAY, s)
            .displayName("Business Phones")
            .category("contact")
            .build(),
        FieldDescriptor.builder("jobTitle", STRING, s)
            .displayName("Job Title")
            .category("organization")
            .aliases("title")
            .build(),
        FieldDescriptor.builder("department", STRING, s)
            .displayName("Department")
            .category("organization")
            .build(),
        FieldDescriptor.builder("companyName", STRING, s)
            .displayName("Company")
            .category("organization")
            .build(),
        FieldDescriptor.builder("officeLocation", STRING, s)
            .displayName("Office")
            .category("organization")
            .build(),
        FieldDescriptor.builder("employeeId", STRING, s)
            .displayName("Employee ID")
            .category("organization")
            .build(),
        FieldDescriptor.builder("manager", REFERENCE, s)
            .displayName("Manager")
            .category("organization")
            .build(),
        FieldDescriptor.builder("usageLocation", STRING, s)
            .displayName("Usage Location")
            .category("organization")
            .build(),
        FieldDescriptor.builder("country", STRING, s)
            .displayName("Country")
            .category("organization")
            .build(),
        FieldDescriptor.builder("city", STRING, s)
            .displayName("City")
            .category("organization")
            .build(),
        FieldDescriptor.builder("userType", STRING, s)
            .displayName("User Type")
            .category("identity")
            .description("Member or Guest")
            .build(),
        FieldDescriptor.builder("accountEnabled", BOOLEAN, s)
            .displayName("Enabled")
            .category("security")
            .aliases("enabled")
            .build(),
        FieldDescriptor.builder("createdDateTime", DATETIME, s)
            .displayName("Created")
            .category("activity")
            .aliases("createdAt", "whenCreated")
            .build(),
        FieldDescriptor.builder("lastPasswordChangeDateTime", DATETIME, s)
            .displayName("Password Last Changed")
            .category("security")
            .sensitive()
            .build(),
        FieldDescriptor.builder("lastSignInDateTime", DATETIME, s)
            .displayName("Last Sign-In")
            .nativeName("signInActivity/lastSignInDateTime")
            .category("activity")
            .aliases("lastLogon")
            .build(),
        FieldDescriptor.builder("assignedLicenses", ARRAY, s)
            .displayName("Assigned Licenses")
            .category("licensing")
            .build(),
        FieldDescriptor.builder("proxyAddresses", ARRAY, s)
            .displayName("Proxy Addresses")
            .category("contact")
            .build());
  }

  private static List<FieldDescriptor> cloudSuite() {
    var s = SourceKind.CLOUD_SUITE;
    return List.of(
        FieldDescriptor.builder("userPrincipalName", STRING, s)
            .displayName("User Principal Name")
            .nativeName("User Principal Name")
            .category("identity")
            .aliases("upn")
            .build(),
        FieldDescriptor.builder("displayName", STRING, s)
            .displayName("Display Name")
            .nativeName("Display Name")
            .category("identity")
            .build(),
        FieldDescriptor.builder("isDeleted", BOOLEAN, s)
            .displayName("Deleted")
            .nativeName("Is Deleted")
            .category("identity")
            .build(),
        FieldDescriptor.builder("deletedDate", DATETIME, s)
            .displayName("Deleted Date")
            .nativeName("Deleted Date")
            .category("identity")
            .build(),
        FieldDescriptor.builder("hasExchangeLicense", BOOLEAN, s)
            .displayName("Has Exchange License")
            .nativeName("Has Exchange License")
            .category("licensing")
            .build(),
        FieldDescriptor.builder("hasOneDriveLicense", BOOLEAN, s)
            .displayName("Has OneDrive License")
            .nativeName("Has OneDrive License")
            .category("licensing")
            .build(),
        FieldDescriptor.builder("hasSharePointLicense", BOOLEAN, s)
            .displayName("Has SharePoint License")
            .nativeName("Has SharePoint License")
            .category("licensing")
            .build(),
        FieldDescriptor.builder("hasTeamsLicense", BOOLEAN, s)
            .displayName("Has Teams License")
            .nativeName("Has Teams License")
            .category("licensing")
            .build(),
        FieldDescriptor.builder("exchangeLastActivityDate", DATETIME, s)
            .displayName("Exchange Last Activity")
            .nativeName("Exchange Last Activity Date")
            .category("activity")
            .build(),
        FieldDescriptor.builder("oneDriveLastActivityDate", DATETIME, s)
            .displayName("OneDrive Last Activity")
            .nativeName("OneDrive Last Activity Date")
            .category("activity")
            .build(),
        FieldDescriptor.builder("sharePointLastActivityDate", DATETIME, s)
            .displayName("SharePoint Last Activity")
            .nativeName("SharePoint Last Activity Date")
            .category("activity")
            .build(),
        FieldDescriptor.builder("teamsLastActivityDate", DATETIME, s)
            .displayName("Teams Last Activity")
            .nativeName("Teams Last Activity Date")
            .category("activity")
            .build(),
        FieldDescriptor.builder("assignedProducts", ARRAY, s)
            .displayName("Assigned Products")
            .nativeName("Assigned Products")
            .category("licensing")
            .build(),
        FieldDescriptor.builder("reportRefreshDate", DATETIME, s)
            .displayName("Report Refresh Date")
            .nativeName("Report Refresh Date")
            .category("general")
            .build());
  }
}
